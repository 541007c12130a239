package com.challenges.collector.query;

/**
 * An input value does not have the shape a node needs, such as a non-sequence
 * under an iteration.
 */
public class TypeMismatchException extends CollectionException {
    public TypeMismatchException(String message) {
        super(message);
    }

    static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
