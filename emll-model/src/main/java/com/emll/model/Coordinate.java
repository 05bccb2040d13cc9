package com.emll.model;

/**
 * Reference to one output port of one node, by the node's id within its {@link Model} and the
 * port's index. Confers no ownership.
 *
 * @param nodeId Id of the referenced node
 * @param portIndex Index of the referenced output port
 */
public record Coordinate(int nodeId, int portIndex) {
    public Coordinate {
        if (nodeId < 0) {
            throw new IllegalArgumentException("Node id cannot be negative: " + nodeId);
        }
        if (portIndex < 0) {
            throw new IllegalArgumentException("Port index cannot be negative: " + portIndex);
        }
    }

    @Override
    public String toString() {
        return "(" + nodeId + ", " + portIndex + ")";
    }
}
