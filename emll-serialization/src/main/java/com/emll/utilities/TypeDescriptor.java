package com.emll.utilities;

import com.emll.serialization.Serializable;

import java.lang.ref.Reference;
import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-class capabilities of values held by a {@link Variant}: name, category, how to render
 * and how to copy. Resolved once per class and cached.
 */
final class TypeDescriptor {
    private static final Map<Class<?>, TypeDescriptor> CACHE = new ConcurrentHashMap<>();

    enum Category {
        PRIMITIVE,
        ARRAY,
        SERIALIZABLE,
        POINTER,
        OTHER
    }

    private final Class<?> type;
    private final String name;
    private final Category category;
    private final boolean declaresToString;

    private TypeDescriptor(Class<?> type) {
        this.type = type;
        this.name = TypeName.of(type);
        this.category = categorize(type);
        this.declaresToString = declaresToString(type);
    }

    static TypeDescriptor of(Class<?> type) {
        return CACHE.computeIfAbsent(TypeName.box(type), TypeDescriptor::new);
    }

    Class<?> getType() {
        return type;
    }

    String getName() {
        return name;
    }

    Category getCategory() {
        return category;
    }

    /**
     * Render a value of this type for diagnostics.
     */
    String render(Object value) {
        if (category == Category.ARRAY) {
            String wrapped = Arrays.deepToString(new Object[] {value});
            return wrapped.substring(1, wrapped.length() - 1);
        }
        if (declaresToString) {
            return String.valueOf(value);
        }
        return "<" + name + ">";
    }

    /**
     * Copy a value of this type.
     */
    Object copy(Object value) {
        switch (category) {
            case PRIMITIVE:
                return value;
            case ARRAY:
                return copyArray(value);
            default:
                if (value instanceof Copyable) {
                    return ((Copyable<?>) value).copy();
                }
                return value;
        }
    }

    private static Object copyArray(Object array) {
        Class<?> componentType = array.getClass().getComponentType();
        int length = Array.getLength(array);
        Object copy = Array.newInstance(componentType, length);
        if (componentType.isPrimitive()) {
            System.arraycopy(array, 0, copy, 0, length);
            return copy;
        }
        for (int i = 0; i < length; i++) {
            Object element = Array.get(array, i);
            Array.set(copy, i, element == null ? null : of(element.getClass()).copy(element));
        }
        return copy;
    }

    private static Category categorize(Class<?> type) {
        if (TypeName.isPrimitive(type)) {
            return Category.PRIMITIVE;
        }
        if (type.isArray()) {
            return Category.ARRAY;
        }
        if (Serializable.class.isAssignableFrom(type)) {
            return Category.SERIALIZABLE;
        }
        if (Reference.class.isAssignableFrom(type) || AtomicReference.class.isAssignableFrom(type)) {
            return Category.POINTER;
        }
        return Category.OTHER;
    }

    private static boolean declaresToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("toString() missing on " + type.getName(), e);
        }
    }
}
