package io.github.yok.spectramigrate.core;

import com.google.common.base.Preconditions;
import io.github.yok.spectramigrate.db.StoreDialect;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

/**
 * Restricts a bulk update to target rows whose current value is still unset.
 *
 * <p>
 * Rendered with the column qualified by the target table, because the update joins a values list
 * that carries columns of the same name.
 * </p>
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GuardCondition {

    private enum Kind {
        IS_NULL, NULL_OR_ZERO, NULL_OR_FALSE
    }

    private final Kind kind;
    private final String column;

    /**
     * Matches rows where the column is {@code NULL}.
     *
     * @param column guarded column
     * @return guard
     */
    public static GuardCondition isNull(String column) {
        return new GuardCondition(Kind.IS_NULL, requireColumn(column));
    }

    /**
     * Matches rows where the numeric column is {@code NULL} or {@code 0}.
     *
     * @param column guarded column
     * @return guard
     */
    public static GuardCondition nullOrZero(String column) {
        return new GuardCondition(Kind.NULL_OR_ZERO, requireColumn(column));
    }

    /**
     * Matches rows where the boolean column is {@code NULL} or false.
     *
     * @param column guarded column
     * @return guard
     */
    public static GuardCondition nullOrFalse(String column) {
        return new GuardCondition(Kind.NULL_OR_FALSE, requireColumn(column));
    }

    /**
     * Renders the predicate for the given target table.
     *
     * @param table target table used as qualifier
     * @param dialect target dialect (boolean literal)
     * @return SQL predicate, parenthesized
     */
    public String render(String table, StoreDialect dialect) {
        String qualified = table + "." + column;
        switch (kind) {
            case IS_NULL:
                return "(" + qualified + " IS NULL)";
            case NULL_OR_ZERO:
                return "(" + qualified + " IS NULL OR " + qualified + " = 0)";
            case NULL_OR_FALSE:
                return "(" + qualified + " IS NULL OR " + qualified + " = "
                        + dialect.getBooleanFalseLiteral() + ")";
            default:
                throw new IllegalStateException("Unknown guard: " + kind);
        }
    }

    private static String requireColumn(String column) {
        Preconditions.checkArgument(column != null && !column.isBlank(),
                "guarded column is required");
        return column;
    }
}
