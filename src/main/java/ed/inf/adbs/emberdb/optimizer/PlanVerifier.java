package ed.inf.adbs.emberdb.optimizer;

import ed.inf.adbs.emberdb.exception.PlanningException;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperator;

/**
 * Checks that a physical plan is a faithful lowering of a logical plan: same shape,
 * each physical operator implementing the kind of its logical counterpart, same schema
 * at every position.
 */
public final class PlanVerifier {

    private PlanVerifier() {
    }

    /**
     * @throws PlanningException On the first position where the plans differ.
     */
    public static void verify(LogicalOperator logical, PhysicalOperator physical) {
        if (physical.getType().getImplementedType() != logical.getType()) {
            throw new PlanningException(physical.getType().getDisplayName() + " does not implement "
                    + logical.describe());
        }
        if (!physical.getSchema().equals(logical.getSchema())) {
            throw new PlanningException("Schema of " + physical + " is " + physical.getSchema()
                    + " but " + logical.describe() + " has " + logical.getSchema());
        }
        if (physical.getChildren().size() != logical.getChildren().size()) {
            throw new PlanningException(physical + " has " + physical.getChildren().size()
                    + " children but " + logical.describe() + " has " + logical.getChildren().size());
        }
        for (int i = 0; i < logical.getChildren().size(); i++) {
            verify(logical.getChild(i), physical.getChild(i));
        }
    }
}
