package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.operator.ProjectExec;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;
import ed.inf.adbs.emberdb.plan.ProjectNode;

import java.util.List;

public class ProjectToProjectExecRule implements Rule {

    @Override
    public String getName() {
        return "ProjectToProjectExec";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.PROJECT;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return true;
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        ProjectNode project = (ProjectNode) node;
        return new ProjectExec(project.getExpressions(), project.getNames(), loweredChildren.get(0));
    }
}
