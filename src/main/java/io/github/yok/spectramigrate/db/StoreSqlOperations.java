package io.github.yok.spectramigrate.db;

/**
 * SQL grammar operations for each store dialect.
 */
public interface StoreSqlOperations {

    /**
     * Returns the dialect name used in log messages.
     *
     * @return dialect name
     */
    String getName();

    /**
     * Returns literal for boolean true.
     *
     * @return boolean true literal
     */
    String getBooleanTrueLiteral();

    /**
     * Returns literal for boolean false.
     *
     * @return boolean false literal
     */
    String getBooleanFalseLiteral();

    /**
     * Returns the bind-parameter expression for a value of the given type, including any cast the
     * dialect needs to type parameters inside a {@code VALUES} list.
     *
     * @param type logical column type
     * @return parameter expression, such as {@code ?} or {@code CAST(? AS BIGINT)}
     */
    String parameterExpression(SqlType type);

    /**
     * Appends a row limit to a select statement.
     *
     * @param baseSql select SQL, already ordered
     * @param limit max rows
     * @return limited SQL
     */
    String applyLimit(String baseSql, int limit);

    /**
     * Returns the maximum number of bind parameters accepted by one statement.
     *
     * @return parameter limit
     */
    int getMaxBindParameters();
}
