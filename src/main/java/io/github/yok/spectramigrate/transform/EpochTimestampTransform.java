package io.github.yok.spectramigrate.transform;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Maps an epoch-seconds value to an {@link Instant} (UTC, no timezone adjustment).
 *
 * <p>
 * Integral and fractional numbers and numeric text are accepted; values that already are
 * date/time objects are passed through as instants.
 * </p>
 */
public class EpochTimestampTransform implements ColumnTransform {

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    @Override
    public Object apply(Object value) throws RowTransformException {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant();
        }
        BigDecimal seconds;
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            seconds = BigDecimal.valueOf(((Number) value).longValue());
        } else if (value instanceof Number || value instanceof String) {
            try {
                seconds = new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new RowTransformException("Not an epoch-seconds value: '" + value + "'", e);
            }
        } else {
            throw new RowTransformException(
                    "Unsupported timestamp representation: " + value.getClass().getName());
        }
        return toInstant(seconds);
    }

    private Instant toInstant(BigDecimal seconds) throws RowTransformException {
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).multiply(NANOS_PER_SECOND)
                .setScale(0, RoundingMode.HALF_UP).longValue();
        try {
            return Instant.ofEpochSecond(whole.longValueExact(), nanos);
        } catch (ArithmeticException | DateTimeException e) {
            throw new RowTransformException("Epoch seconds out of range: " + seconds, e);
        }
    }
}
