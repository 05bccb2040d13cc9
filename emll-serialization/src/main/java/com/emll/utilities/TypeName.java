package com.emll.utilities;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps Java types to stable string identifiers.
 *
 * <p>Primitive values get short fixed names ({@code int}, {@code double}, ...), arrays of them
 * are named {@code vector(<element>)}, and classes that declare a public static
 * {@code getTypeName()} method are named by it. Any other class falls back to its simple name.
 */
public final class TypeName {
    private static final Map<Class<?>, String> PRIMITIVE_NAMES = new HashMap<>();
    private static final Map<String, Class<?>> PRIMITIVE_CLASSES = new HashMap<>();
    private static final Map<Class<?>, Class<?>> WRAPPERS = new HashMap<>();
    private static final Map<Class<?>, String> NAME_CACHE = new ConcurrentHashMap<>();

    static {
        primitive(Boolean.class, boolean.class, "bool");
        primitive(Character.class, char.class, "char");
        primitive(Byte.class, byte.class, "byte");
        primitive(Short.class, short.class, "short");
        primitive(Integer.class, int.class, "int");
        primitive(Long.class, long.class, "int64");
        primitive(Float.class, float.class, "float");
        primitive(Double.class, double.class, "double");
        PRIMITIVE_NAMES.put(String.class, "string");
        PRIMITIVE_CLASSES.put("string", String.class);
    }

    private TypeName() {
    }

    private static void primitive(Class<?> wrapper, Class<?> primitive, String name) {
        PRIMITIVE_NAMES.put(wrapper, name);
        PRIMITIVE_CLASSES.put(name, wrapper);
        WRAPPERS.put(primitive, wrapper);
    }

    /**
     * Get the stable name of a type.
     *
     * @param type Type to name
     * @return Name of the type
     */
    public static String of(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        Class<?> boxed = box(type);
        String name = NAME_CACHE.get(boxed);
        if (name == null) {
            // Not computeIfAbsent: naming an array type recurses into its element type
            name = computeName(boxed);
            NAME_CACHE.putIfAbsent(boxed, name);
        }
        return name;
    }

    /**
     * Look up the wrapper class of a primitive type name.
     *
     * @param name A name produced by {@link #of(Class)} for a primitive or string type
     * @return The wrapper class, or empty if the name is not a primitive type name
     */
    public static Optional<Class<?>> primitiveClassFor(String name) {
        return Optional.ofNullable(PRIMITIVE_CLASSES.get(name));
    }

    /**
     * Check whether a type is one of the primitive (inline) types: boxed or unboxed primitives and
     * {@link String}.
     *
     * @param type Type to check
     * @return True if values of the type are written inline
     */
    public static boolean isPrimitive(Class<?> type) {
        return PRIMITIVE_NAMES.containsKey(box(type));
    }

    /**
     * Replace a primitive class by its wrapper. Other classes are returned unchanged.
     *
     * @param type Type to box
     * @return Wrapper class or the type itself
     */
    public static Class<?> box(Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    private static String computeName(Class<?> type) {
        String primitiveName = PRIMITIVE_NAMES.get(type);
        if (primitiveName != null) {
            return primitiveName;
        }
        if (type.isArray()) {
            return "vector(" + of(type.getComponentType()) + ")";
        }
        return declaredTypeName(type).orElse(type.getSimpleName());
    }

    private static Optional<String> declaredTypeName(Class<?> type) {
        Method method;
        try {
            method = type.getMethod("getTypeName");
        } catch (NoSuchMethodException e) {
            return Optional.empty();
        }
        if (!Modifier.isStatic(method.getModifiers()) || method.getReturnType() != String.class) {
            return Optional.empty();
        }
        // Inherited static accessors name the superclass, not this type
        if (method.getDeclaringClass() != type) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable((String) method.invoke(null));
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to read type name of " + type.getName(), e);
        }
    }
}
