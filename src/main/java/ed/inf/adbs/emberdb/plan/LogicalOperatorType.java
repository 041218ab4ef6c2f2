package ed.inf.adbs.emberdb.plan;

/**
 * Tag of each logical operator variant. The optimizer keys its rule lists on it.
 */
public enum LogicalOperatorType {
    SCAN,
    FILTER,
    PROJECT,
    GROUP_AGGREGATE,
    JOIN,
    SORT,
    LIMIT
}
