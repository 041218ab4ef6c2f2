package ed.inf.adbs.emberdb.optimizer;

import ed.inf.adbs.emberdb.EngineOptions;
import ed.inf.adbs.emberdb.catalog.Catalog;
import ed.inf.adbs.emberdb.exception.PlanningException;
import ed.inf.adbs.emberdb.exception.UnsupportedAggregateException;
import ed.inf.adbs.emberdb.exception.UnsupportedJoinException;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Lowers a logical plan into a physical plan with a fixed rule set.
 * <p>
 * The tree is lowered bottom-up in a single pass: each node's children are lowered first,
 * then the first matching rule for the node's kind builds its physical operator. The logical
 * tree is not modified. A node no rule matches aborts planning. The result is checked to be
 * structurally isomorphic to the input, with equal schemas at every position.
 */
public class RuleBasedOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(RuleBasedOptimizer.class);

    private final RuleSet ruleSet;

    public RuleBasedOptimizer(RuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    public RuleBasedOptimizer(Catalog catalog, EngineOptions options) {
        this(RuleSet.defaults(catalog, options));
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    /**
     * @param root The root of a logical plan.
     * @return A fresh physical plan, not yet opened.
     * @throws UnsupportedJoinException If a join has no matching rule.
     * @throws UnsupportedAggregateException If an aggregate has no matching rule.
     * @throws PlanningException If any other node has no matching rule, or the plan is not a tree.
     */
    public PhysicalOperator optimize(LogicalOperator root) {
        checkStrictTree(root, Collections.newSetFromMap(new IdentityHashMap<>()));
        PhysicalOperator physical = lower(root);
        PlanVerifier.verify(root, physical);
        if (logger.isDebugEnabled()) {
            logger.debug("Physical plan:\n{}", physical.explain());
        }
        return physical;
    }

    private static void checkStrictTree(LogicalOperator node, Set<LogicalOperator> seen) {
        if (!seen.add(node)) {
            throw new PlanningException("Logical plan is not a tree: " + node.describe() + " appears more than once");
        }
        for (LogicalOperator child : node.getChildren()) {
            checkStrictTree(child, seen);
        }
    }

    private PhysicalOperator lower(LogicalOperator node) {
        List<PhysicalOperator> loweredChildren = new ArrayList<>();
        for (LogicalOperator child : node.getChildren()) {
            loweredChildren.add(lower(child));
        }
        List<PhysicalOperator> view = Collections.unmodifiableList(loweredChildren);
        for (Rule rule : ruleSet.rulesFor(node.getType())) {
            if (rule.matches(node, view)) {
                logger.debug("Rule {} lowers {}", rule.getName(), node.describe());
                return rule.apply(node, view);
            }
        }
        switch (node.getType()) {
            case JOIN:
                throw new UnsupportedJoinException("No rule implements this join; only equi-joins on column pairs "
                        + "of hashable types are supported", node);
            case GROUP_AGGREGATE:
                throw new UnsupportedAggregateException("No rule implements this aggregation; group keys "
                        + "must be of hashable types", node);
            default:
                throw new PlanningException("No rule matches " + node.describe());
        }
    }
}
