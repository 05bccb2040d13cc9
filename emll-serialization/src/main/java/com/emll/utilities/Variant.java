package com.emll.utilities;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A runtime-typed box holding exactly one value whose type is only known at runtime.
 *
 * <p>The variant remembers the exact class of the value it holds. Reading the value back
 * requires naming that class; any other class, including supertypes and other numeric types,
 * fails with {@link TypeMismatchException}. Primitive classes are treated as their wrappers, so
 * {@code int.class} and {@code Integer.class} are the same type.
 *
 * <p>Variants are not thread-safe.
 */
public final class Variant {
    private TypeDescriptor descriptor;
    private Object value;

    private Variant(TypeDescriptor descriptor, Object value) {
        this.descriptor = descriptor;
        this.value = value;
    }

    /**
     * Create an empty variant.
     *
     * @return A variant holding nothing
     */
    public static Variant empty() {
        return new Variant(null, null);
    }

    /**
     * Create a variant holding the given value. The stored type is the value's runtime class.
     *
     * @param value Value to hold
     * @param <T> Type of the value
     * @return A new variant
     */
    public static <T> Variant of(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Variant value cannot be null, use Variant.empty()");
        }
        return new Variant(TypeDescriptor.of(value.getClass()), value);
    }

    /**
     * Create a variant holding a value of an explicitly named type.
     *
     * @param type Type to store; must be exactly the runtime class of the value
     * @param value Value to hold
     * @param <T> Type of the value
     * @return A new variant
     * @throws IllegalArgumentException If the value is null or not exactly of the given type
     */
    public static <T> Variant of(Class<T> type, T value) {
        if (value == null) {
            throw new IllegalArgumentException("Variant value cannot be null, use Variant.empty()");
        }
        if (TypeName.box(type) != value.getClass()) {
            throw new IllegalArgumentException(
                    "Value of class " + value.getClass().getName() + " cannot be stored as " + type.getName());
        }
        return new Variant(TypeDescriptor.of(type), value);
    }

    /**
     * Get the held value.
     *
     * @param type Exact type of the held value
     * @param <T> Type of the value
     * @return The held value
     * @throws TypeMismatchException If the variant is empty or holds another type
     */
    @SuppressWarnings("unchecked")
    public <T> T getValue(Class<T> type) {
        if (!isType(type)) {
            throw new TypeMismatchException(getType(), type);
        }
        return (T) value;
    }

    /**
     * Get the held value if it has the given type.
     *
     * @param type Exact type of the held value
     * @param <T> Type of the value
     * @return The held value, or empty if the variant is empty or holds another type
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> tryGetValue(Class<T> type) {
        return isType(type) ? Optional.of((T) value) : Optional.empty();
    }

    /**
     * Replace the held value. The stored type becomes the new value's runtime class.
     *
     * @param value New value
     */
    public void setValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Variant value cannot be null, use clear()");
        }
        TypeDescriptor newDescriptor = TypeDescriptor.of(value.getClass());
        this.descriptor = newDescriptor;
        this.value = value;
    }

    /**
     * Release the held value, leaving the variant empty.
     */
    public void clear() {
        this.descriptor = null;
        this.value = null;
    }

    public boolean isEmpty() {
        return descriptor == null;
    }

    /**
     * Check whether the held value has exactly the given type.
     *
     * @param type Type to check
     * @return True if the variant holds a value of that type
     */
    public boolean isType(Class<?> type) {
        return descriptor != null && descriptor.getType() == TypeName.box(type);
    }

    /**
     * Get the stored type.
     *
     * @return Class of the held value, or null if empty
     */
    public Class<?> getType() {
        return descriptor == null ? null : descriptor.getType();
    }

    /**
     * Get the stable name of the stored type, see {@link TypeName}.
     *
     * @return Type name, or null if empty
     */
    public String getTypeName() {
        return descriptor == null ? null : descriptor.getName();
    }

    public boolean isPrimitiveType() {
        return descriptor != null && descriptor.getCategory() == TypeDescriptor.Category.PRIMITIVE;
    }

    public boolean isSerializable() {
        return descriptor != null && descriptor.getCategory() == TypeDescriptor.Category.SERIALIZABLE;
    }

    public boolean isPointer() {
        return descriptor != null && descriptor.getCategory() == TypeDescriptor.Category.POINTER;
    }

    public boolean isArray() {
        return descriptor != null && descriptor.getCategory() == TypeDescriptor.Category.ARRAY;
    }

    /**
     * Create an independent copy of this variant, copying the held value as well.
     * Immutable values are shared, arrays are cloned element by element and {@link Copyable}
     * values are copied through {@link Copyable#copy()}.
     *
     * @return A new variant
     */
    public Variant copy() {
        if (descriptor == null) {
            return empty();
        }
        return new Variant(descriptor, descriptor.copy(value));
    }

    /**
     * Render the held value for diagnostics. Types that do not declare their own
     * {@code toString()} are rendered as {@code <TypeName>}.
     */
    @Override
    public String toString() {
        if (descriptor == null) {
            return "<empty>";
        }
        return descriptor.render(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Variant that = (Variant) o;
        return Objects.equals(getType(), that.getType()) && Objects.deepEquals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType()) * 31 + Arrays.deepHashCode(new Object[] {value});
    }
}
