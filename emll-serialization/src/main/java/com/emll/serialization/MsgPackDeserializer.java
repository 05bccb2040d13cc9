package com.emll.serialization;

import com.emll.utilities.TypeName;
import com.emll.utilities.Variant;
import org.msgpack.core.MessageIntegerOverflowException;
import org.msgpack.value.Value;

import java.util.ArrayList;
import java.util.List;

import static com.emll.serialization.MsgPackSerializer.FIELDS_KEY;
import static com.emll.serialization.MsgPackSerializer.TYPE_KEY;
import static com.emll.serialization.MsgPackSerializer.VALUE_KEY;

/**
 * {@link Deserializer} reading the properties of one object from a MessagePack value tree
 * produced by {@link MsgPackSerializer}.
 */
public class MsgPackDeserializer implements Deserializer {
    private final String typeName;
    private final Value[] keyValues;
    private final DeserializationContext context;
    private final int depth;
    private int position;

    MsgPackDeserializer(String typeName, Value[] keyValues, DeserializationContext context, int depth) {
        this.typeName = typeName;
        this.keyValues = keyValues;
        this.context = context;
        this.depth = depth;
    }

    /**
     * Decode an object tree.
     *
     * @param value Encoded object
     * @param type Java type the root object must be assignable to
     * @param context Context providing the registry
     * @param <T> Expected type
     * @return Decoded object, or null if nil was encoded
     * @throws UnregisteredTypeException If a stored type name is not registered
     * @throws MalformedStreamException If the tree does not match what the objects read
     */
    public static <T extends Serializable> T decode(Value value, Class<T> type, DeserializationContext context) {
        return decodeObject(value, type, context, 1, "<root>");
    }

    private static <T extends Serializable> T decodeObject(Value value, Class<T> type, DeserializationContext context,
                                                           int depth, String property) {
        if (value.isNilValue()) {
            return null;
        }
        if (depth > context.getMaxDepth()) {
            throw new MalformedStreamException("Object nesting exceeds maximum depth of " + context.getMaxDepth()
                    + " at property '" + property + "'");
        }

        TaggedValue tagged = TaggedValue.read(value, property);
        if (!FIELDS_KEY.equals(tagged.key) || !tagged.payload.isMapValue()) {
            throw new MalformedStreamException("Property '" + property + "' does not hold an object");
        }

        Serializable instance = context.getRegistry().create(tagged.typeName, context);
        if (!type.isInstance(instance)) {
            throw new MalformedStreamException("Property '" + property + "' holds type '" + tagged.typeName
                    + "', expected " + type.getSimpleName());
        }

        MsgPackDeserializer fields = new MsgPackDeserializer(
                tagged.typeName, tagged.payload.asMapValue().getKeyValueArray(), context, depth);
        instance.deserialize(fields);
        fields.finish();
        return type.cast(instance);
    }

    /**
     * Check that every stored property was consumed.
     *
     * @throws MalformedStreamException If properties are left over
     */
    void finish() {
        if (position < keyValues.length) {
            throw new MalformedStreamException("Unread property '" + keyString(keyValues[position])
                    + "' in " + typeName);
        }
    }

    @Override
    public boolean readBoolean(String name) {
        Value value = next(name);
        if (!value.isBooleanValue()) {
            throw kindMismatch(name, "boolean", value);
        }
        return value.asBooleanValue().getBoolean();
    }

    @Override
    public int readInt(String name) {
        Value value = next(name);
        if (!value.isIntegerValue() || !value.asIntegerValue().isInIntRange()) {
            throw kindMismatch(name, "int", value);
        }
        return value.asIntegerValue().toInt();
    }

    @Override
    public long readLong(String name) {
        Value value = next(name);
        if (!value.isIntegerValue() || !value.asIntegerValue().isInLongRange()) {
            throw kindMismatch(name, "int64", value);
        }
        return value.asIntegerValue().toLong();
    }

    @Override
    public double readDouble(String name) {
        Value value = next(name);
        if (!value.isFloatValue()) {
            throw kindMismatch(name, "double", value);
        }
        return value.asFloatValue().toDouble();
    }

    @Override
    public String readString(String name) {
        Value value = next(name);
        if (value.isNilValue()) {
            return null;
        }
        if (!value.isStringValue()) {
            throw kindMismatch(name, "string", value);
        }
        return value.asStringValue().asString();
    }

    @Override
    public double[] readDoubleArray(String name) {
        return decodeDoubles(name, next(name));
    }

    @Override
    public int[] readIntArray(String name) {
        return decodeInts(name, next(name));
    }

    @Override
    public List<String> readStringList(String name) {
        List<Value> elements = arrayElements(name, next(name), "vector(string)");
        List<String> values = new ArrayList<>(elements.size());
        for (Value element : elements) {
            if (!element.isStringValue()) {
                throw kindMismatch(name, "string", element);
            }
            values.add(element.asStringValue().asString());
        }
        return values;
    }

    @Override
    public <T extends Serializable> T readObject(String name, Class<T> type) {
        return decodeObject(next(name), type, context, depth + 1, name);
    }

    @Override
    public <T extends Serializable> List<T> readObjectList(String name, Class<T> type) {
        List<Value> elements = arrayElements(name, next(name), "object list");
        List<T> values = new ArrayList<>(elements.size());
        for (Value element : elements) {
            values.add(decodeObject(element, type, context, depth + 1, name));
        }
        return values;
    }

    @Override
    public Variant readVariant(String name) {
        return decodeVariant(name, next(name));
    }

    @Override
    public PropertyBag readProperties(String name) {
        Value value = next(name);
        if (!value.isMapValue()) {
            throw kindMismatch(name, "property map", value);
        }

        PropertyBag properties = new PropertyBag();
        Value[] entries = value.asMapValue().getKeyValueArray();
        for (int i = 0; i < entries.length; i += 2) {
            String propertyName = keyString(entries[i]);
            properties.setVariant(propertyName, decodeVariant(propertyName, entries[i + 1]));
        }
        return properties;
    }

    @Override
    public DeserializationContext getContext() {
        return context;
    }

    private Variant decodeVariant(String name, Value value) {
        if (value.isNilValue()) {
            return Variant.empty();
        }

        TaggedValue tagged = TaggedValue.read(value, name);
        if (FIELDS_KEY.equals(tagged.key)) {
            return Variant.of(decodeObject(value, Serializable.class, context, depth + 1, name));
        }
        if (!VALUE_KEY.equals(tagged.key)) {
            throw new MalformedStreamException("Property '" + name + "' has unexpected key '" + tagged.key + "'");
        }

        if ("vector(double)".equals(tagged.typeName)) {
            return Variant.of(decodeDoubles(name, tagged.payload));
        }
        if ("vector(int)".equals(tagged.typeName)) {
            return Variant.of(decodeInts(name, tagged.payload));
        }
        Class<?> type = TypeName.primitiveClassFor(tagged.typeName)
                .orElseThrow(() -> new MalformedStreamException(
                        "Property '" + name + "' has unknown inline type '" + tagged.typeName + "'"));
        return Variant.of(decodePrimitive(name, type, tagged.payload));
    }

    private Object decodePrimitive(String name, Class<?> type, Value value) {
        try {
            if (type == Boolean.class && value.isBooleanValue()) {
                return value.asBooleanValue().getBoolean();
            } else if (type == Double.class && value.isFloatValue()) {
                return value.asFloatValue().toDouble();
            } else if (type == Float.class && value.isFloatValue()) {
                return value.asFloatValue().toFloat();
            } else if (type == Long.class && value.isIntegerValue()) {
                return value.asIntegerValue().asLong();
            } else if (type == Integer.class && value.isIntegerValue()) {
                return value.asIntegerValue().asInt();
            } else if (type == Short.class && value.isIntegerValue()) {
                return value.asIntegerValue().asShort();
            } else if (type == Byte.class && value.isIntegerValue()) {
                return value.asIntegerValue().asByte();
            } else if (type == String.class && value.isStringValue()) {
                return value.asStringValue().asString();
            } else if (type == Character.class && value.isStringValue()
                    && value.asStringValue().asString().length() == 1) {
                return value.asStringValue().asString().charAt(0);
            }
        } catch (MessageIntegerOverflowException e) {
            throw new MalformedStreamException("Property '" + name + "' overflows " + TypeName.of(type), e);
        }
        throw kindMismatch(name, TypeName.of(type), value);
    }

    private double[] decodeDoubles(String name, Value value) {
        List<Value> elements = arrayElements(name, value, "vector(double)");
        double[] values = new double[elements.size()];
        for (int i = 0; i < values.length; i++) {
            Value element = elements.get(i);
            if (!element.isFloatValue()) {
                throw kindMismatch(name, "double", element);
            }
            values[i] = element.asFloatValue().toDouble();
        }
        return values;
    }

    private int[] decodeInts(String name, Value value) {
        List<Value> elements = arrayElements(name, value, "vector(int)");
        int[] values = new int[elements.size()];
        for (int i = 0; i < values.length; i++) {
            Value element = elements.get(i);
            if (!element.isIntegerValue() || !element.asIntegerValue().isInIntRange()) {
                throw kindMismatch(name, "int", element);
            }
            values[i] = element.asIntegerValue().toInt();
        }
        return values;
    }

    private List<Value> arrayElements(String name, Value value, String expected) {
        if (!value.isArrayValue()) {
            throw kindMismatch(name, expected, value);
        }
        return value.asArrayValue().list();
    }

    private Value next(String name) {
        if (position >= keyValues.length) {
            throw new MalformedStreamException("Expected property '" + name + "' in " + typeName
                    + " but no properties are left");
        }
        String storedName = keyString(keyValues[position]);
        if (!storedName.equals(name)) {
            throw new MalformedStreamException("Expected property '" + name + "' in " + typeName
                    + " but found '" + storedName + "'");
        }
        Value value = keyValues[position + 1];
        position += 2;
        return value;
    }

    private MalformedStreamException kindMismatch(String name, String expected, Value value) {
        return new MalformedStreamException("Property '" + name + "' in " + typeName + " should hold "
                + expected + " but holds " + value.getValueType().name().toLowerCase());
    }

    private static String keyString(Value key) {
        if (!key.isStringValue()) {
            throw new MalformedStreamException("Property names must be strings, found " + key);
        }
        return key.asStringValue().asString();
    }

    /**
     * A {@code {"__type__": name, key: payload}} pair.
     */
    private static final class TaggedValue {
        final String typeName;
        final String key;
        final Value payload;

        private TaggedValue(String typeName, String key, Value payload) {
            this.typeName = typeName;
            this.key = key;
            this.payload = payload;
        }

        static TaggedValue read(Value value, String property) {
            if (!value.isMapValue() || value.asMapValue().size() != 2) {
                throw new MalformedStreamException("Property '" + property + "' is not a type-tagged value");
            }
            Value[] entries = value.asMapValue().getKeyValueArray();
            if (!TYPE_KEY.equals(keyString(entries[0])) || !entries[1].isStringValue()) {
                throw new MalformedStreamException("Property '" + property + "' is missing its type name");
            }
            return new TaggedValue(entries[1].asStringValue().asString(), keyString(entries[2]), entries[3]);
        }
    }
}
