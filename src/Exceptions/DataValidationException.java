package Exceptions;

/**
 * Thrown when balance-sheet or scenario input fails validation.
 * An object whose construction raised this exception must not be used.
 */
public class DataValidationException extends Exception {

    public DataValidationException(String message) {
        super(message);
    }

    public DataValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
