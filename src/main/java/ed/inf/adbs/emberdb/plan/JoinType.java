package ed.inf.adbs.emberdb.plan;

/**
 * Join semantics. Outer joins pad the rows of the preserved side that found no match with NULLs.
 */
public enum JoinType {

    INNER(false, false),
    LEFT(true, false),
    RIGHT(false, true),
    FULL(true, true);

    private final boolean preservesLeft;
    private final boolean preservesRight;

    JoinType(boolean preservesLeft, boolean preservesRight) {
        this.preservesLeft = preservesLeft;
        this.preservesRight = preservesRight;
    }

    /**
     * @return true if every left row appears in the output.
     */
    public boolean preservesLeft() {
        return preservesLeft;
    }

    /**
     * @return true if every right row appears in the output.
     */
    public boolean preservesRight() {
        return preservesRight;
    }
}
