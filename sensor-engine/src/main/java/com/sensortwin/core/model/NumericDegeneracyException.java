package com.sensortwin.core.model;

/**
 * Raised when a computation on a reading degenerates for the current sample,
 * for example a zero-length orientation or a non-finite intermediate value.
 * The imperfection pipeline skips the contribution of the stage that raised
 * it and continues.
 *
 * @since 1.0.0
 */
public class NumericDegeneracyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NumericDegeneracyException(String message) {
        super(message);
    }
}
