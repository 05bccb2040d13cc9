package com.emll.utilities;

/**
 * Exception thrown when a {@link Variant} is read back under a type other than the one it holds.
 */
public class TypeMismatchException extends RuntimeException {
    private final Class<?> heldType;
    private final Class<?> requestedType;

    /**
     * Create a new type mismatch exception.
     *
     * @param heldType Type held by the variant, or null if the variant is empty
     * @param requestedType Type the caller asked for
     */
    public TypeMismatchException(Class<?> heldType, Class<?> requestedType) {
        super(heldType == null
                ? "Variant is empty, cannot read it as " + TypeName.of(requestedType)
                : "Variant holds " + TypeName.of(heldType) + ", cannot read it as " + TypeName.of(requestedType));
        this.heldType = heldType;
        this.requestedType = requestedType;
    }

    /**
     * Get the type held by the variant.
     *
     * @return Held type, or null if the variant was empty
     */
    public Class<?> getHeldType() {
        return heldType;
    }

    /**
     * Get the type the caller asked for.
     *
     * @return Requested type
     */
    public Class<?> getRequestedType() {
        return requestedType;
    }
}
