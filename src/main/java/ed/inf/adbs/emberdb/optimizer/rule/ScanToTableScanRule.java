package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.catalog.Catalog;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.operator.TableScan;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;
import ed.inf.adbs.emberdb.plan.ScanNode;

import java.util.List;

/**
 * Scan to TableScan, unconditionally. The estimate comes from the catalog.
 */
public class ScanToTableScanRule implements Rule {

    private final Catalog catalog;

    public ScanToTableScanRule(Catalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public String getName() {
        return "ScanToTableScan";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.SCAN;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return true;
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        ScanNode scan = (ScanNode) node;
        return new TableScan(catalog, scan.getTableName(), scan.getReferenceName(), scan.getTableSchema(),
                catalog.estimatedRowCount(scan.getTableName()));
    }
}
