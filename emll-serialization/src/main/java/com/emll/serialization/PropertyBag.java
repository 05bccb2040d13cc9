package com.emll.serialization;

import com.emll.utilities.Variant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Ordered collection of named {@link Variant} values of mixed types.
 */
public class PropertyBag {
    private final Map<String, Variant> properties = new LinkedHashMap<>();

    /**
     * Set a property, replacing any previous value with the same name.
     *
     * @param name Property name
     * @param value Property value
     * @return This bag
     */
    public PropertyBag set(String name, Object value) {
        return setVariant(name, Variant.of(value));
    }

    /**
     * Set a property from a variant. An empty variant is kept as an entry without a value.
     *
     * @param name Property name
     * @param value Property value
     * @return This bag
     */
    public PropertyBag setVariant(String name, Variant value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Property name cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("Property value cannot be null");
        }
        properties.put(name, value);
        return this;
    }

    /**
     * Get a property value.
     *
     * @param name Property name
     * @param type Exact type of the value
     * @param <T> Type of the value
     * @return The value
     * @throws NoSuchElementException If no property with the given name exists
     * @throws com.emll.utilities.TypeMismatchException If the value has another type
     */
    public <T> T get(String name, Class<T> type) {
        return getVariant(name).getValue(type);
    }

    /**
     * Get a property as a variant.
     *
     * @param name Property name
     * @return The variant
     * @throws NoSuchElementException If no property with the given name exists
     */
    public Variant getVariant(String name) {
        Variant value = properties.get(name);
        if (value == null) {
            throw new NoSuchElementException("No property named '" + name + "'");
        }
        return value;
    }

    public boolean contains(String name) {
        return properties.containsKey(name);
    }

    public PropertyBag remove(String name) {
        properties.remove(name);
        return this;
    }

    /**
     * Get the property names in insertion order.
     *
     * @return Unmodifiable set of names
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(properties.keySet());
    }

    public int size() {
        return properties.size();
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    /**
     * Create a copy of this bag, copying every variant.
     *
     * @return New bag
     */
    public PropertyBag copy() {
        PropertyBag copy = new PropertyBag();
        properties.forEach((name, value) -> copy.setVariant(name, value.copy()));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return properties.equals(((PropertyBag) o).properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
