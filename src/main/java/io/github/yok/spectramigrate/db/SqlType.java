package io.github.yok.spectramigrate.db;

import java.sql.Types;

/**
 * Logical column types understood by the store dialects.
 *
 * <p>
 * Each dialect maps a type to its own cast expression and binding rule; {@link #getJdbcType()} is
 * used for {@code setNull}.
 * </p>
 */
public enum SqlType {

    BIGINT(Types.BIGINT),
    INTEGER(Types.INTEGER),
    DOUBLE(Types.DOUBLE),
    BOOLEAN(Types.BOOLEAN),
    TEXT(Types.VARCHAR),
    BINARY(Types.BINARY),
    TIMESTAMP(Types.TIMESTAMP_WITH_TIMEZONE),
    DOUBLE_ARRAY(Types.ARRAY);

    private final int jdbcType;

    SqlType(int jdbcType) {
        this.jdbcType = jdbcType;
    }

    /**
     * Returns the {@link Types} code of this type.
     *
     * @return JDBC type code
     */
    public int getJdbcType() {
        return jdbcType;
    }
}
