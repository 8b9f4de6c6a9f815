package io.github.yok.spectramigrate.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import io.github.yok.spectramigrate.db.RelationalStore;
import io.github.yok.spectramigrate.db.StoreDialect;
import io.github.yok.spectramigrate.transform.RowTransformException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Reconciles one entity between a source store and a target store.
 *
 * <p>
 * Two write operations are offered:
 * </p>
 * <ul>
 * <li>{@link #copyMissing}: inserts source rows whose key is absent from the target. All inserts
 * of one call share a single transaction.</li>
 * <li>{@link #updateColumns}: copies column values onto existing target rows, restricted by a
 * {@link GuardCondition}, in key-ordered batches that are committed one by one.</li>
 * </ul>
 *
 * <p>
 * Both operations are idempotent: the existence check and the guard re-select exactly the rows that
 * still need work, so an interrupted run can simply be started again. A row whose value cannot be
 * transformed is logged and skipped; any SQL error rolls back the open transaction and is raised as
 * {@link MigrationException.Kind#PHASE_FAILED}.
 * </p>
 */
@Slf4j
@Component
public class ReconcilingCopier {

    /**
     * Counts the rows of a table matching a predicate.
     *
     * @param store store to query
     * @param table table name
     * @param predicate SQL predicate without {@code WHERE}, or {@code null} for all rows
     * @return number of matching rows
     * @throws SQLException if the query fails
     */
    public long count(RelationalStore store, String table, String predicate)
            throws SQLException {
        return store.count(table, predicate);
    }

    /**
     * Inserts every source row whose key does not exist in the target.
     *
     * @param source source store
     * @param target target store
     * @param descriptor entity to copy
     * @param batchSize JDBC batch size of the insert statement
     * @param progressInterval inserted rows between two progress log lines
     * @return inserted, skipped and failed row counts
     * @throws MigrationException if a SQL or binding error aborted the copy (nothing was committed)
     */
    public CopyResult copyMissing(RelationalStore source, RelationalStore target,
            EntityDescriptor descriptor, int batchSize, int progressInterval) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive");
        Preconditions.checkArgument(progressInterval > 0, "progressInterval must be positive");

        String table = descriptor.getTable();
        List<ColumnSpec> columns = descriptor.allColumns();
        String selectSql = "SELECT " + descriptor.columnList() + " FROM " + table
                + where(descriptor.getSourceFilter()) + " ORDER BY "
                + descriptor.getKey().getName();
        String existsSql =
                "SELECT 1 FROM " + table + " WHERE " + descriptor.getKey().getName() + " = ?";
        String insertSql = insertSql(descriptor, target.getDialect());
        log.debug("[{}] {}", table, insertSql);

        long inserted = 0;
        long skipped = 0;
        long failed = 0;
        int pending = 0;
        try {
            target.begin();
            try (PreparedStatement select = source.prepare(selectSql);
                    PreparedStatement exists = target.prepare(existsSql);
                    PreparedStatement insert = target.prepare(insertSql);
                    ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    Object[] values = readRow(rs, columns);
                    Object key = values[0];
                    if (exists(exists, target.getDialect(), descriptor.getKey(), key)) {
                        skipped++;
                        continue;
                    }
                    Object[] transformed;
                    try {
                        transformed = transform(columns, values);
                    } catch (RowTransformException e) {
                        failed++;
                        log.warn("[{}] Skipping {}={}: {}", table, descriptor.getKey().getName(),
                                key, e.getMessage());
                        continue;
                    }
                    bindRow(insert, target.getDialect(), columns, transformed, 1);
                    insert.addBatch();
                    pending++;
                    inserted++;
                    if (pending >= batchSize) {
                        insert.executeBatch();
                        pending = 0;
                    }
                    if (inserted % progressInterval == 0) {
                        log.info("[{}] Progress: {} inserted, {} skipped", table, inserted,
                                skipped);
                    }
                }
                if (pending > 0) {
                    insert.executeBatch();
                }
            }
            target.commit();
            target.end();
        } catch (SQLException | RuntimeException e) {
            target.rollback(e);
            throw new MigrationException(MigrationException.Kind.PHASE_FAILED,
                    "Copy of " + table + " failed; " + inserted
                            + " uncommitted insert(s) rolled back",
                    e);
        }
        CopyResult result = new CopyResult(inserted, skipped, failed);
        log.info("[{}] Copy finished: {}", table, result);
        return result;
    }

    /**
     * Copies the descriptor's columns onto existing target rows that pass the guard.
     *
     * <p>
     * Source rows are read with keyset pagination. Each page becomes one committed batch, applied
     * as a bulk update that joins a {@code VALUES} list:
     * </p>
     *
     * <pre>
     * WITH v(id, speed) AS (VALUES (?, ?), (?, ?))
     * UPDATE markers SET speed = v.speed FROM v
     * WHERE markers.id = v.id AND (markers.speed IS NULL OR markers.speed = 0)
     * </pre>
     *
     * @param source source store
     * @param target target store
     * @param descriptor entity and columns to copy
     * @param guard condition a target row must satisfy to be changed
     * @param batchSize source rows per committed batch
     * @return batch, processed, updated and failed counts
     * @throws MigrationException if a SQL or binding error aborted a batch (earlier batches stay committed)
     */
    public UpdateResult updateColumns(RelationalStore source, RelationalStore target,
            EntityDescriptor descriptor, GuardCondition guard, int batchSize) {
        Preconditions.checkNotNull(guard, "guard must not be null");
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive");

        String table = descriptor.getTable();
        String keyName = descriptor.getKey().getName();
        List<ColumnSpec> columns = descriptor.allColumns();
        StoreDialect targetDialect = target.getDialect();
        int rowsPerStatement = Math.max(1, targetDialect.getMaxBindParameters() / columns.size());

        int batches = 0;
        long processed = 0;
        long updated = 0;
        long failed = 0;
        Object lastKey = null;
        try {
            target.begin();
            while (true) {
                List<Object[]> page = readPage(source, descriptor, lastKey, batchSize);
                if (page.isEmpty()) {
                    break;
                }
                lastKey = page.get(page.size() - 1)[0];
                processed += page.size();

                List<Object[]> rows = new ArrayList<>(page.size());
                for (Object[] values : page) {
                    try {
                        rows.add(transform(columns, values));
                    } catch (RowTransformException e) {
                        failed++;
                        log.warn("[{}] Skipping {}={}: {}", table, keyName, values[0],
                                e.getMessage());
                    }
                }
                long changed = 0;
                for (List<Object[]> chunk : Lists.partition(rows, rowsPerStatement)) {
                    changed += applyUpdate(target, descriptor, guard, chunk);
                }
                target.commit();
                batches++;
                updated += changed;
                log.info("[{}] Batch {}: {} row(s) read, {} updated (total {} / {})", table,
                        batches, page.size(), changed, updated, processed);
                if (page.size() < batchSize) {
                    break;
                }
            }
            target.end();
        } catch (SQLException | RuntimeException e) {
            target.rollback(e);
            throw new MigrationException(MigrationException.Kind.PHASE_FAILED,
                    "Update of " + table + " failed in batch " + (batches + 1) + " after "
                            + updated + " committed update(s); batch rolled back",
                    e);
        }
        UpdateResult result = new UpdateResult(batches, processed, updated, failed);
        log.info("[{}] Update finished: {}", table, result);
        return result;
    }

    /**
     * Copies one scalar column onto existing target rows that pass the guard.
     *
     * @param source source store
     * @param target target store
     * @param table table present in both stores
     * @param key primary key column
     * @param column column to copy
     * @param sourceFilter predicate selecting source rows, or {@code null}
     * @param guard condition a target row must satisfy to be changed
     * @param batchSize source rows per committed batch
     * @return batch, processed, updated and failed counts
     */
    public UpdateResult updateScalarColumn(RelationalStore source, RelationalStore target,
            String table, ColumnSpec key, ColumnSpec column, String sourceFilter,
            GuardCondition guard, int batchSize) {
        EntityDescriptor descriptor = EntityDescriptor.builder().table(table).key(key)
                .column(column).sourceFilter(sourceFilter).build();
        return updateColumns(source, target, descriptor, guard, batchSize);
    }

    private List<Object[]> readPage(RelationalStore source, EntityDescriptor descriptor,
            Object lastKey, int batchSize) throws SQLException {
        ColumnSpec key = descriptor.getKey();
        List<String> predicates = new ArrayList<>();
        if (StringUtils.isNotBlank(descriptor.getSourceFilter())) {
            predicates.add("(" + descriptor.getSourceFilter() + ")");
        }
        if (lastKey != null) {
            predicates.add(key.getName() + " > ?");
        }
        String sql = "SELECT " + descriptor.columnList() + " FROM " + descriptor.getTable()
                + where(String.join(" AND ", predicates)) + " ORDER BY " + key.getName();
        sql = source.getDialect().applyLimit(sql, batchSize);

        List<Object[]> page = new ArrayList<>(batchSize);
        try (PreparedStatement select = source.prepare(sql)) {
            if (lastKey != null) {
                source.getDialect().bindValue(select, 1, lastKey, key.getType());
            }
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    page.add(readRow(rs, descriptor.allColumns()));
                }
            }
        }
        return page;
    }

    private int applyUpdate(RelationalStore target, EntityDescriptor descriptor,
            GuardCondition guard, List<Object[]> rows) throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }
        StoreDialect dialect = target.getDialect();
        List<ColumnSpec> columns = descriptor.allColumns();
        String sql = updateSql(descriptor, guard, dialect, rows.size());
        try (PreparedStatement update = target.prepare(sql)) {
            int index = 1;
            for (Object[] row : rows) {
                index = bindRow(update, dialect, columns, row, index);
            }
            return update.executeUpdate();
        }
    }

    static String insertSql(EntityDescriptor descriptor, StoreDialect dialect) {
        StringBuilder params = new StringBuilder();
        for (ColumnSpec column : descriptor.allColumns()) {
            if (params.length() > 0) {
                params.append(", ");
            }
            params.append(dialect.parameterExpression(column.getType()));
        }
        return "INSERT INTO " + descriptor.getTable() + " (" + descriptor.columnList()
                + ") VALUES (" + params + ")";
    }

    static String updateSql(EntityDescriptor descriptor, GuardCondition guard,
            StoreDialect dialect, int rowCount) {
        String table = descriptor.getTable();
        String keyName = descriptor.getKey().getName();

        StringBuilder tuple = new StringBuilder("(");
        for (ColumnSpec column : descriptor.allColumns()) {
            if (tuple.length() > 1) {
                tuple.append(", ");
            }
            tuple.append(dialect.parameterExpression(column.getType()));
        }
        tuple.append(')');

        StringBuilder sql = new StringBuilder("WITH v(").append(descriptor.columnList())
                .append(") AS (VALUES ");
        for (int i = 0; i < rowCount; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(tuple);
        }
        sql.append(") UPDATE ").append(table).append(" SET ");
        boolean first = true;
        for (ColumnSpec column : descriptor.getColumns()) {
            if (!first) {
                sql.append(", ");
            }
            sql.append(column.getName()).append(" = v.").append(column.getName());
            first = false;
        }
        sql.append(" FROM v WHERE ").append(table).append('.').append(keyName).append(" = v.")
                .append(keyName).append(" AND ").append(guard.render(table, dialect));
        return sql.toString();
    }

    private static boolean exists(PreparedStatement exists, StoreDialect dialect, ColumnSpec key,
            Object value) throws SQLException {
        dialect.bindValue(exists, 1, value, key.getType());
        try (ResultSet rs = exists.executeQuery()) {
            return rs.next();
        }
    }

    private static Object[] readRow(ResultSet rs, List<ColumnSpec> columns) throws SQLException {
        Object[] values = new Object[columns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = rs.getObject(i + 1);
        }
        return values;
    }

    private static Object[] transform(List<ColumnSpec> columns, Object[] values)
            throws RowTransformException {
        Object[] transformed = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            ColumnSpec column = columns.get(i);
            try {
                transformed[i] = column.getTransform().apply(values[i]);
            } catch (RowTransformException e) {
                throw new RowTransformException(column.getName() + ": " + e.getMessage(), e);
            }
        }
        return transformed;
    }

    private static int bindRow(PreparedStatement statement, StoreDialect dialect,
            List<ColumnSpec> columns, Object[] values, int startIndex) throws SQLException {
        int index = startIndex;
        for (int i = 0; i < values.length; i++) {
            dialect.bindValue(statement, index++, values[i], columns.get(i).getType());
        }
        return index;
    }

    private static String where(String predicate) {
        return StringUtils.isBlank(predicate) ? "" : " WHERE " + predicate;
    }
}
