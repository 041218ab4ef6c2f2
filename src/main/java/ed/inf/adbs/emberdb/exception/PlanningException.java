package ed.inf.adbs.emberdb.exception;

/**
 * Raised when a query cannot be turned into an executable plan.
 * Planning errors are always fatal to the query, no partial plan is ever returned.
 * Subclasses name the specific failure; this class itself is used for query shapes
 * the planner does not handle at all (non-SELECT statements, subqueries in FROM, etc).
 */
public class PlanningException extends EmberDBException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
