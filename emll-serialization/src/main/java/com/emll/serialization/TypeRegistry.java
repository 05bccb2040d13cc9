package com.emll.serialization;

import com.emll.utilities.TypeName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry mapping type names to factories of {@link Serializable} kinds.
 *
 * <p>Every kind must be registered before an archive containing it is read. Lookups of names
 * that were never registered fail with {@link UnregisteredTypeException}; registering a name
 * twice fails with {@link DuplicateTypeException}.
 */
public class TypeRegistry {
    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    private static final TypeRegistry DEFAULT = new TypeRegistry();

    private final Map<String, Registration<?>> registrations = new ConcurrentHashMap<>();

    private static final class Registration<T extends Serializable> {
        final Class<T> type;
        final TypeFactory<? extends T> factory;

        Registration(Class<T> type, TypeFactory<? extends T> factory) {
            this.type = type;
            this.factory = factory;
        }
    }

    /**
     * Get the process-wide registry.
     *
     * @return Default registry
     */
    public static TypeRegistry getDefault() {
        return DEFAULT;
    }

    /**
     * Register a factory under an explicit type name.
     *
     * @param typeName Type name written to archives
     * @param type Class of the instances the factory creates
     * @param factory Factory receiving the deserialization context
     * @param <T> Registered type
     * @return This registry
     * @throws DuplicateTypeException If the name is already registered
     */
    public <T extends Serializable> TypeRegistry register(String typeName, Class<T> type, TypeFactory<? extends T> factory) {
        if (typeName == null || typeName.isEmpty()) {
            throw new IllegalArgumentException("Type name cannot be null or empty");
        }
        if (type == null || factory == null) {
            throw new IllegalArgumentException("Type and factory cannot be null");
        }

        Registration<?> previous = registrations.putIfAbsent(typeName, new Registration<>(type, factory));
        if (previous != null) {
            throw new DuplicateTypeException(typeName);
        }
        log.debug("Registered serializable type '{}' as {}", typeName, type.getName());
        return this;
    }

    /**
     * Register a zero-argument factory under the type's own name, as reported by
     * {@link TypeName#of(Class)}.
     *
     * @param type Class to register
     * @param constructor Factory creating default instances
     * @param <T> Registered type
     * @return This registry
     * @throws DuplicateTypeException If the name is already registered
     */
    public <T extends Serializable> TypeRegistry register(Class<T> type, Supplier<? extends T> constructor) {
        if (constructor == null) {
            throw new IllegalArgumentException("Constructor cannot be null");
        }
        return register(TypeName.of(type), type, context -> constructor.get());
    }

    /**
     * Check if a type name is registered.
     *
     * @param typeName Type name
     * @return True if a factory is registered under the name
     */
    public boolean isRegistered(String typeName) {
        return registrations.containsKey(typeName);
    }

    /**
     * Get the class registered under a type name.
     *
     * @param typeName Type name
     * @return Registered class
     * @throws UnregisteredTypeException If the name is not registered
     */
    public Class<? extends Serializable> getType(String typeName) {
        return lookup(typeName).type;
    }

    /**
     * Create a default instance of the kind registered under a type name.
     *
     * @param typeName Type name
     * @param context Context of the deserialization in progress
     * @return New instance
     * @throws UnregisteredTypeException If the name is not registered
     */
    public Serializable create(String typeName, DeserializationContext context) {
        Registration<?> registration = lookup(typeName);
        Serializable instance = registration.factory.create(context);
        if (!registration.type.isInstance(instance)) {
            throw new SerializationException("Factory for type '" + typeName + "' created "
                    + (instance == null ? "null" : instance.getClass().getName()));
        }
        return instance;
    }

    /**
     * Get all registered type names.
     *
     * @return Sorted, unmodifiable set of names
     */
    public Set<String> getTypeNames() {
        return Collections.unmodifiableSet(new TreeSet<>(registrations.keySet()));
    }

    private Registration<?> lookup(String typeName) {
        Registration<?> registration = registrations.get(typeName);
        if (registration == null) {
            throw new UnregisteredTypeException(typeName);
        }
        return registration;
    }
}
