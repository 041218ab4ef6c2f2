package ed.inf.adbs.emberdb.exception;

/**
 * Root of every error raised by the EmberDB planning and execution core.
 * All EmberDB exceptions are unchecked: a failed query is aborted as a whole and the
 * caller decides whether to retry.
 */
public class EmberDBException extends RuntimeException {

    public EmberDBException(String message) {
        super(message);
    }

    public EmberDBException(String message, Throwable cause) {
        super(message, cause);
    }
}
