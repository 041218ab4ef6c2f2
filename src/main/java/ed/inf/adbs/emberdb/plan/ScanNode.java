package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;

import java.util.Collections;
import java.util.List;

/**
 * Leaf reading a catalog table. The schema is the declared table schema with every field
 * qualified by the alias, or by the table name when there is no alias.
 */
public final class ScanNode extends LogicalOperator {

    private final String tableName;
    private final String alias;
    private final Schema tableSchema;

    public ScanNode(String tableName, String alias, Schema tableSchema) {
        super(Collections.emptyList());
        this.tableName = tableName;
        this.alias = alias;
        this.tableSchema = tableSchema;
        initSchema();
    }

    public String getTableName() {
        return tableName;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * @return The name other clauses use to qualify this table's columns.
     */
    public String getReferenceName() {
        return alias != null ? alias : tableName;
    }

    public Schema getTableSchema() {
        return tableSchema;
    }

    @Override
    protected Schema deriveSchema() {
        return SchemaDerivations.scan(tableSchema, getReferenceName());
    }

    @Override
    public LogicalOperatorType getType() {
        return LogicalOperatorType.SCAN;
    }

    @Override
    public String describe() {
        return "Scan(" + tableName + (alias != null ? " AS " + alias : "") + ")";
    }

    @Override
    public LogicalOperator withChildren(List<LogicalOperator> newChildren) {
        checkArity(newChildren, 0);
        return new ScanNode(tableName, alias, tableSchema);
    }
}
