package ed.inf.adbs.emberdb.operator;

/**
 * Lifecycle of a physical operator. Transitions only go forward: an operator is never reopened.
 */
public enum OperatorState {
    CREATED,
    OPEN,
    CLOSED
}
