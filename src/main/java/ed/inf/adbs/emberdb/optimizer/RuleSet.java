package ed.inf.adbs.emberdb.optimizer;

import ed.inf.adbs.emberdb.EngineOptions;
import ed.inf.adbs.emberdb.catalog.Catalog;
import ed.inf.adbs.emberdb.optimizer.rule.FilterToFilterExecRule;
import ed.inf.adbs.emberdb.optimizer.rule.GroupAggregateToHashAggregateRule;
import ed.inf.adbs.emberdb.optimizer.rule.JoinToHashJoinRule;
import ed.inf.adbs.emberdb.optimizer.rule.LimitToLimitExecRule;
import ed.inf.adbs.emberdb.optimizer.rule.ProjectToProjectExecRule;
import ed.inf.adbs.emberdb.optimizer.rule.ScanToTableScanRule;
import ed.inf.adbs.emberdb.optimizer.rule.SortToExternalSortRule;
import ed.inf.adbs.emberdb.optimizer.rule.SortToInMemorySortRule;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable, ordered list of rules per logical node kind. For each node the optimizer
 * applies the first rule of its kind that matches.
 */
public final class RuleSet {

    private final Map<LogicalOperatorType, List<Rule>> rules;

    private RuleSet(Map<LogicalOperatorType, List<Rule>> rules) {
        Map<LogicalOperatorType, List<Rule>> copy = new EnumMap<>(LogicalOperatorType.class);
        for (LogicalOperatorType type : LogicalOperatorType.values()) {
            List<Rule> forType = rules.get(type);
            copy.put(type, forType == null
                    ? Collections.<Rule>emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(forType)));
        }
        this.rules = copy;
    }

    /**
     * The standard rules. Sorts estimated above the spill threshold sort externally.
     */
    public static RuleSet defaults(Catalog catalog, EngineOptions options) {
        return builder()
                .add(new ScanToTableScanRule(catalog))
                .add(new FilterToFilterExecRule())
                .add(new ProjectToProjectExecRule())
                .add(new GroupAggregateToHashAggregateRule())
                .add(new JoinToHashJoinRule())
                .add(new SortToExternalSortRule(options))
                .add(new SortToInMemorySortRule(options))
                .add(new LimitToLimitExecRule())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return A builder starting from this rule set.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        for (List<Rule> forType : rules.values()) {
            for (Rule rule : forType) {
                builder.add(rule);
            }
        }
        return builder;
    }

    /**
     * @return The rules for the kind, in priority order.
     */
    public List<Rule> rulesFor(LogicalOperatorType type) {
        return rules.get(type);
    }

    public static final class Builder {

        private final Map<LogicalOperatorType, List<Rule>> rules = new EnumMap<>(LogicalOperatorType.class);

        private Builder() {
        }

        /**
         * Adds a rule after the existing rules of its kind.
         */
        public Builder add(Rule rule) {
            rules.computeIfAbsent(rule.getTarget(), t -> new ArrayList<>()).add(rule);
            return this;
        }

        /**
         * Adds a rule before the existing rules of its kind, so it takes precedence.
         */
        public Builder prepend(Rule rule) {
            rules.computeIfAbsent(rule.getTarget(), t -> new ArrayList<>()).add(0, rule);
            return this;
        }

        public RuleSet build() {
            return new RuleSet(rules);
        }
    }
}
