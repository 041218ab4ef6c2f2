package ed.inf.adbs.emberdb.exception;

/**
 * Raised while a physical plan is running. Wraps storage failures and resource
 * acquisition failures from open/next so that callers see a single error type,
 * after every operator that had been opened has been closed.
 */
public class ExecutionException extends EmberDBException {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
