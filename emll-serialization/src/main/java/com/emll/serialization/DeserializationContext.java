package com.emll.serialization;

/**
 * State shared by all objects read during one load: the registry that resolves type names and
 * the nesting limit.
 */
public class DeserializationContext {
    private final TypeRegistry registry;
    private final int maxDepth;

    /**
     * Create a deserialization context.
     *
     * @param registry Registry used to construct nested objects
     * @param maxDepth Maximum nesting depth of objects
     */
    public DeserializationContext(TypeRegistry registry, int maxDepth) {
        if (registry == null) {
            throw new IllegalArgumentException("Registry cannot be null");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be positive");
        }
        this.registry = registry;
        this.maxDepth = maxDepth;
    }

    public TypeRegistry getRegistry() {
        return registry;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
