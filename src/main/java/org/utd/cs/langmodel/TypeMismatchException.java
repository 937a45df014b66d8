package org.utd.cs.langmodel;

/**
 * Thrown when counting text whose elements are not n-grams.
 */
public class TypeMismatchException extends IllegalArgumentException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
