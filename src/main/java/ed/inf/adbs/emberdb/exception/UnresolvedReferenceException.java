package ed.inf.adbs.emberdb.exception;

/**
 * Raised by the plan builder when a table, column or function name cannot be resolved,
 * or when an unqualified column name is ambiguous in its scope.
 */
public class UnresolvedReferenceException extends PlanningException {

    private final String reference;

    public UnresolvedReferenceException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    /**
     * @return The name that failed to resolve, as written in the query.
     */
    public String getReference() {
        return reference;
    }
}
