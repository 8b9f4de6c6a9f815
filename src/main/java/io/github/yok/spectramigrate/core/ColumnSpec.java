package io.github.yok.spectramigrate.core;

import com.google.common.base.Preconditions;
import io.github.yok.spectramigrate.db.SqlType;
import io.github.yok.spectramigrate.transform.ColumnTransform;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One column moved by the copier: its name (identical in both stores), its target type and the
 * transform applied to source values.
 */
@Getter
@ToString(exclude = "transform")
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ColumnSpec {

    private final String name;
    private final SqlType type;
    private final ColumnTransform transform;

    /**
     * Creates a column copied as-is.
     *
     * @param name column name
     * @param type target type
     * @return column spec
     */
    public static ColumnSpec of(String name, SqlType type) {
        return of(name, type, ColumnTransform.IDENTITY);
    }

    /**
     * Creates a column with a transform.
     *
     * @param name column name
     * @param type target type
     * @param transform transform applied to every source value
     * @return column spec
     */
    public static ColumnSpec of(String name, SqlType type, ColumnTransform transform) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "column name is required");
        Preconditions.checkNotNull(type, "type must not be null");
        Preconditions.checkNotNull(transform, "transform must not be null");
        return new ColumnSpec(name, type, transform);
    }
}
