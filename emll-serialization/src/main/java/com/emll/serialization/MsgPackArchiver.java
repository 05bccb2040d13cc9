package com.emll.serialization;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.Value;
import org.msgpack.value.ValueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves {@link Serializable} object graphs to MessagePack bytes and loads them back.
 *
 * <p>Loading resolves every stored type name through the configured {@link TypeRegistry}.
 */
public class MsgPackArchiver {
    private static final Logger log = LoggerFactory.getLogger(MsgPackArchiver.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    // An object spans at most this many nested MessagePack containers before its children begin
    private static final int CONTAINERS_PER_OBJECT = 4;

    private final TypeRegistry registry;
    private final int maxDepth;

    private MsgPackArchiver(TypeRegistry registry, int maxDepth) {
        this.registry = registry;
        this.maxDepth = maxDepth;
    }

    /**
     * Create an archiver using the default registry and nesting limit.
     *
     * @return New archiver
     */
    public static MsgPackArchiver create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TypeRegistry getRegistry() {
        return registry;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Save an object graph.
     *
     * @param obj Root object
     * @return Serialized bytes
     * @throws SerializationException If the object graph cannot be encoded
     */
    public byte[] save(Serializable obj) {
        if (obj == null) {
            throw new IllegalArgumentException("Root object cannot be null");
        }
        Value value = MsgPackSerializer.encode(obj, maxDepth);
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packValue(value);
            byte[] bytes = packer.toByteArray();
            log.debug("Saved {} to {} bytes", obj.getRuntimeTypeName(), bytes.length);
            return bytes;
        } catch (IOException e) {
            throw new SerializationException("Failed to save " + obj.getRuntimeTypeName(), e);
        }
    }

    /**
     * Save an object graph to a stream. The stream is not closed.
     *
     * @param obj Root object
     * @param out Destination stream
     * @throws SerializationException If encoding or writing fails
     */
    public void save(Serializable obj, OutputStream out) {
        byte[] bytes = save(obj);
        try {
            out.write(bytes);
            out.flush();
        } catch (IOException e) {
            throw new SerializationException("Failed to write " + obj.getRuntimeTypeName(), e);
        }
    }

    /**
     * Load an object graph.
     *
     * @param data Bytes produced by {@link #save(Serializable)}
     * @param type Java type the root object must be assignable to
     * @param <T> Expected type
     * @return Root object
     * @throws UnregisteredTypeException If a stored type name is not registered
     * @throws MalformedStreamException If the bytes do not hold a well-formed object graph
     */
    public <T extends Serializable> T load(byte[] data, Class<T> type) {
        Value value = unpack(data);
        T result;
        try {
            result = MsgPackDeserializer.decode(value, type, new DeserializationContext(registry, maxDepth));
        } catch (MessagePackException e) {
            // Strings are decoded lazily, so invalid text only surfaces here
            throw new MalformedStreamException("Archive holds invalid data: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new MalformedStreamException("Archive holds no object");
        }
        log.debug("Loaded {} from {} bytes", result.getRuntimeTypeName(), data.length);
        return result;
    }

    /**
     * Load an object graph from a stream. The stream is read to its end but not closed.
     *
     * @param in Source stream
     * @param type Java type the root object must be assignable to
     * @param <T> Expected type
     * @return Root object
     */
    public <T extends Serializable> T load(InputStream in, Class<T> type) {
        byte[] data;
        try {
            data = in.readAllBytes();
        } catch (IOException e) {
            throw new SerializationException("Failed to read archive", e);
        }
        return load(data, type);
    }

    /**
     * Render saved bytes as JSON, for diagnostics.
     *
     * @param data Bytes produced by {@link #save(Serializable)}
     * @return JSON text
     */
    public String toJson(byte[] data) {
        Value value = unpack(data);
        try {
            return value.toJson();
        } catch (MessagePackException e) {
            throw new MalformedStreamException("Archive holds invalid data: " + e.getMessage(), e);
        }
    }

    private Value unpack(byte[] data) {
        if (data == null || data.length == 0) {
            throw new MalformedStreamException("Archive is empty");
        }
        long containerLimit = (long) CONTAINERS_PER_OBJECT * (maxDepth + 1);
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(data)) {
            Value value = unpackValue(unpacker, 1, containerLimit);
            if (unpacker.hasNext()) {
                throw new MalformedStreamException("Archive has trailing data");
            }
            return value;
        } catch (MessagePackException e) {
            throw new MalformedStreamException("Archive is not valid MessagePack", e);
        } catch (IOException e) {
            throw new SerializationException("Failed to read archive", e);
        }
    }

    private static Value unpackValue(MessageUnpacker unpacker, long depth, long containerLimit) throws IOException {
        switch (unpacker.getNextFormat().getValueType()) {
            case ARRAY: {
                checkNesting(depth, containerLimit);
                int size = unpacker.unpackArrayHeader();
                List<Value> elements = new ArrayList<>(Math.min(size, 1024));
                for (int i = 0; i < size; i++) {
                    elements.add(unpackValue(unpacker, depth + 1, containerLimit));
                }
                return ValueFactory.newArray(elements);
            }
            case MAP: {
                checkNesting(depth, containerLimit);
                int size = unpacker.unpackMapHeader();
                List<Value> keyValues = new ArrayList<>(Math.min(size, 1024) * 2);
                for (int i = 0; i < size; i++) {
                    keyValues.add(unpackValue(unpacker, depth + 1, containerLimit));
                    keyValues.add(unpackValue(unpacker, depth + 1, containerLimit));
                }
                return ValueFactory.newMap(keyValues.toArray(new Value[0]));
            }
            default:
                return unpacker.unpackValue();
        }
    }

    private static void checkNesting(long depth, long containerLimit) {
        if (depth > containerLimit) {
            throw new MalformedStreamException("Archive nesting exceeds " + containerLimit + " levels");
        }
    }

    /**
     * Builder for {@link MsgPackArchiver}.
     */
    public static class Builder {
        private TypeRegistry registry = TypeRegistry.getDefault();
        private int maxDepth = DEFAULT_MAX_DEPTH;

        /**
         * Set the registry used to resolve type names when loading.
         *
         * @param registry Type registry
         * @return This builder
         */
        public Builder registry(TypeRegistry registry) {
            if (registry == null) {
                throw new IllegalArgumentException("Registry cannot be null");
            }
            this.registry = registry;
            return this;
        }

        /**
         * Set the maximum nesting depth of objects, both when saving and loading.
         *
         * @param maxDepth Maximum depth, at least 1
         * @return This builder
         */
        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("Max depth must be positive");
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public MsgPackArchiver build() {
            return new MsgPackArchiver(registry, maxDepth);
        }
    }
}
