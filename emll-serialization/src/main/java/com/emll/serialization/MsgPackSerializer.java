package com.emll.serialization;

import com.emll.utilities.Variant;
import org.msgpack.value.Value;
import org.msgpack.value.ValueFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link Serializer} that collects the properties of one object as a MessagePack value tree.
 *
 * <p>An object is encoded as the map {@code {"__type__": <type name>, "fields": {...}}} whose
 * fields keep their write order. Inline variant values are encoded as
 * {@code {"__type__": <type name>, "value": <value>}}; null objects and empty variants as nil.
 */
public class MsgPackSerializer implements Serializer {
    static final String TYPE_KEY = "__type__";
    static final String FIELDS_KEY = "fields";
    static final String VALUE_KEY = "value";

    private final List<Value> keyValues = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private final String typeName;
    private final int depth;
    private final int maxDepth;

    MsgPackSerializer(String typeName, int depth, int maxDepth) {
        this.typeName = typeName;
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    /**
     * Encode an object and everything it references.
     *
     * @param obj Object to encode, may be null
     * @param maxDepth Maximum nesting depth
     * @return MessagePack value tree
     * @throws SerializationException If the object cannot be encoded
     */
    public static Value encode(Serializable obj, int maxDepth) {
        return encodeObject(obj, 1, maxDepth);
    }

    private static Value encodeObject(Serializable obj, int depth, int maxDepth) {
        if (obj == null) {
            return ValueFactory.newNil();
        }
        if (depth > maxDepth) {
            throw new SerializationException("Object nesting exceeds maximum depth of " + maxDepth
                    + " at type '" + obj.getRuntimeTypeName() + "'");
        }

        String typeName = obj.getRuntimeTypeName();
        MsgPackSerializer fields = new MsgPackSerializer(typeName, depth, maxDepth);
        obj.serialize(fields);
        return tagged(typeName, FIELDS_KEY, fields.toValue());
    }

    private static Value tagged(String typeName, String key, Value payload) {
        return ValueFactory.newMap(
                ValueFactory.newString(TYPE_KEY), ValueFactory.newString(typeName),
                ValueFactory.newString(key), payload);
    }

    Value toValue() {
        return ValueFactory.newMap(keyValues.toArray(new Value[0]));
    }

    @Override
    public void writeBoolean(String name, boolean value) {
        put(name, ValueFactory.newBoolean(value));
    }

    @Override
    public void writeInt(String name, int value) {
        put(name, ValueFactory.newInteger(value));
    }

    @Override
    public void writeLong(String name, long value) {
        put(name, ValueFactory.newInteger(value));
    }

    @Override
    public void writeDouble(String name, double value) {
        put(name, ValueFactory.newFloat(value));
    }

    @Override
    public void writeString(String name, String value) {
        put(name, value == null ? ValueFactory.newNil() : ValueFactory.newString(value));
    }

    @Override
    public void writeDoubleArray(String name, double[] values) {
        requireValue(name, values);
        put(name, encodeDoubles(values));
    }

    @Override
    public void writeIntArray(String name, int[] values) {
        requireValue(name, values);
        put(name, encodeInts(values));
    }

    @Override
    public void writeStringList(String name, List<String> values) {
        requireValue(name, values);
        List<Value> elements = new ArrayList<>(values.size());
        for (String value : values) {
            if (value == null) {
                throw new IllegalArgumentException("String list '" + name + "' of " + typeName + " contains null");
            }
            elements.add(ValueFactory.newString(value));
        }
        put(name, ValueFactory.newArray(elements));
    }

    @Override
    public void writeObject(String name, Serializable value) {
        put(name, encodeObject(value, depth + 1, maxDepth));
    }

    @Override
    public void writeObjectList(String name, List<? extends Serializable> values) {
        requireValue(name, values);
        List<Value> elements = new ArrayList<>(values.size());
        for (Serializable value : values) {
            elements.add(encodeObject(value, depth + 1, maxDepth));
        }
        put(name, ValueFactory.newArray(elements));
    }

    @Override
    public void writeVariant(String name, Variant value) {
        put(name, encodeVariant(name, value));
    }

    @Override
    public void writeProperties(String name, PropertyBag properties) {
        requireValue(name, properties);
        List<Value> entries = new ArrayList<>(properties.size() * 2);
        for (String propertyName : properties.names()) {
            entries.add(ValueFactory.newString(propertyName));
            entries.add(encodeVariant(propertyName, properties.getVariant(propertyName)));
        }
        put(name, ValueFactory.newMap(entries.toArray(new Value[0])));
    }

    private Value encodeVariant(String name, Variant variant) {
        if (variant == null || variant.isEmpty()) {
            return ValueFactory.newNil();
        }
        if (variant.isPointer()) {
            throw new PointerPropertyException(name, variant.getTypeName());
        }

        Object value = variant.getValue(variant.getType());
        if (variant.isSerializable()) {
            return encodeObject((Serializable) value, depth + 1, maxDepth);
        }
        if (variant.isPrimitiveType()) {
            return tagged(variant.getTypeName(), VALUE_KEY, encodePrimitive(value));
        }
        if (value instanceof double[]) {
            return tagged(variant.getTypeName(), VALUE_KEY, encodeDoubles((double[]) value));
        }
        if (value instanceof int[]) {
            return tagged(variant.getTypeName(), VALUE_KEY, encodeInts((int[]) value));
        }
        throw new UnsupportedPropertyTypeException(name, variant.getTypeName());
    }

    private static Value encodePrimitive(Object value) {
        if (value instanceof Boolean) {
            return ValueFactory.newBoolean((Boolean) value);
        } else if (value instanceof Float || value instanceof Double) {
            return ValueFactory.newFloat(((Number) value).doubleValue());
        } else if (value instanceof Number) {
            return ValueFactory.newInteger(((Number) value).longValue());
        } else {
            // String and Character
            return ValueFactory.newString(value.toString());
        }
    }

    private static Value encodeDoubles(double[] values) {
        List<Value> elements = new ArrayList<>(values.length);
        for (double value : values) {
            elements.add(ValueFactory.newFloat(value));
        }
        return ValueFactory.newArray(elements);
    }

    private static Value encodeInts(int[] values) {
        List<Value> elements = new ArrayList<>(values.length);
        for (int value : values) {
            elements.add(ValueFactory.newInteger(value));
        }
        return ValueFactory.newArray(elements);
    }

    private void requireValue(String name, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Property '" + name + "' of " + typeName + " cannot be null");
        }
    }

    private void put(String name, Value value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Property name cannot be null or empty");
        }
        if (!names.add(name)) {
            throw new SerializationException("Property '" + name + "' written twice by " + typeName);
        }
        keyValues.add(ValueFactory.newString(name));
        keyValues.add(value);
    }
}
