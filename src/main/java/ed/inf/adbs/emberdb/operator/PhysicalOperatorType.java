package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.plan.LogicalOperatorType;

/**
 * Tag of each physical operator variant, with the logical kind it implements.
 */
public enum PhysicalOperatorType {

    TABLE_SCAN("TableScan", LogicalOperatorType.SCAN),
    FILTER("FilterExec", LogicalOperatorType.FILTER),
    PROJECT("ProjectExec", LogicalOperatorType.PROJECT),
    HASH_AGGREGATE("HashAggregate", LogicalOperatorType.GROUP_AGGREGATE),
    HASH_JOIN("HashJoin", LogicalOperatorType.JOIN),
    SORT("SortExec", LogicalOperatorType.SORT),
    LIMIT("LimitExec", LogicalOperatorType.LIMIT);

    private final String displayName;
    private final LogicalOperatorType implementedType;

    PhysicalOperatorType(String displayName, LogicalOperatorType implementedType) {
        this.displayName = displayName;
        this.implementedType = implementedType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public LogicalOperatorType getImplementedType() {
        return implementedType;
    }
}
