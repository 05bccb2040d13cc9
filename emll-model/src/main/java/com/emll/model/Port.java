package com.emll.model;

/**
 * A named scalar output of a node.
 *
 * @param name Port name
 * @param index Port index within the node's outputs
 */
public record Port(String name, int index) {
}
