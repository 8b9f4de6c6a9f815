package io.github.yok.spectramigrate.transform;

/**
 * Converts a value read from the source into the value written to the target.
 */
@FunctionalInterface
public interface ColumnTransform {

    /**
     * Transform that returns the source value unchanged.
     */
    ColumnTransform IDENTITY = value -> value;

    /**
     * Converts one column value.
     *
     * @param value value as returned by the source driver, may be {@code null}
     * @return value to bind for the target, may be {@code null}
     * @throws RowTransformException if the value cannot be converted (the row is skipped)
     */
    Object apply(Object value) throws RowTransformException;
}
