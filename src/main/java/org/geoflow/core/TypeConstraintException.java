package org.geoflow.core;

/**
 * Thrown when an argument does not have the capability or shape a block requires.
 */
public final class TypeConstraintException extends GeometryBlockException {

    public TypeConstraintException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public TypeConstraintException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }

    /**
     * Describes the runtime type of a rejected argument, {@code null} included.
     */
    public static String describeType(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
