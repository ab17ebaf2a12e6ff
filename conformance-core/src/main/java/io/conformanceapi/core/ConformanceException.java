package io.conformanceapi.core;

/**
 * Base class for conformance API runtime errors.
 *
 * <p>Subclasses are specific to the error condition and preserve the original cause when applicable.
 */
public abstract class ConformanceException extends RuntimeException {

    protected ConformanceException(String message) {
        super(message);
    }

    protected ConformanceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an API implementation hands back a result with neither a value nor an error, or a value that
     * matches none of the endpoint's response shapes. Indicates a bug in the implementation and is never
     * recovered from.
     */
    public static class ResultContractViolation extends ConformanceException {
        public static final String MESSAGE = "Result must have an error or value.";

        public ResultContractViolation(String endpoint) {
            super(MESSAGE + " (" + endpoint + ")");
        }
    }

    /**
     * Raised when a response payload cannot be written as JSON.
     */
    public static class PayloadSerializationFailure extends ConformanceException {
        public PayloadSerializationFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
