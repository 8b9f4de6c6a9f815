package io.github.yok.spectramigrate.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Describes one entity the copier moves: table, primary key, copied columns and the predicate that
 * selects source rows.
 *
 * <pre>
 * EntityDescriptor.builder()
 *         .table("markers")
 *         .key(ColumnSpec.of("id", SqlType.BIGINT))
 *         .column(ColumnSpec.of("speed", SqlType.DOUBLE))
 *         .sourceFilter("speed IS NOT NULL AND speed > 0")
 *         .build();
 * </pre>
 */
@Getter
@ToString
public final class EntityDescriptor {

    private final String table;
    private final ColumnSpec key;
    private final List<ColumnSpec> columns;
    // SQL predicate on the source table, null for all rows
    private final String sourceFilter;

    @Builder
    private EntityDescriptor(String table, ColumnSpec key, @Singular List<ColumnSpec> columns,
            String sourceFilter) {
        Preconditions.checkArgument(table != null && !table.isBlank(), "table is required");
        Preconditions.checkNotNull(key, "key column is required");
        Preconditions.checkArgument(!columns.isEmpty(), "at least one column is required");
        this.table = table;
        this.key = key;
        this.columns = ImmutableList.copyOf(columns);
        this.sourceFilter = sourceFilter;
    }

    /**
     * Returns the key column followed by the copied columns.
     *
     * @return all columns in select order
     */
    public List<ColumnSpec> allColumns() {
        return ImmutableList.<ColumnSpec>builder().add(key).addAll(columns).build();
    }

    /**
     * Returns a comma-separated list of all column names in select order.
     *
     * @return column list for SQL
     */
    public String columnList() {
        StringBuilder sb = new StringBuilder();
        for (ColumnSpec column : allColumns()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(column.getName());
        }
        return sb.toString();
    }
}
