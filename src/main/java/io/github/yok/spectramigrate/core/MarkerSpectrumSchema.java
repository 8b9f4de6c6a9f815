package io.github.yok.spectramigrate.core;

import io.github.yok.spectramigrate.db.SqlType;
import io.github.yok.spectramigrate.db.StoreDialect;
import io.github.yok.spectramigrate.transform.ChannelArrayTransform;
import io.github.yok.spectramigrate.transform.EpochTimestampTransform;

/**
 * Table layout of the marker and spectrum data, expressed as copier descriptors, guards and count
 * predicates.
 */
public final class MarkerSpectrumSchema {

    public static final String MARKERS = "markers";
    public static final String SPECTRA = "spectra";
    public static final String ID = "id";
    public static final String HAS_SPECTRUM = "has_spectrum";
    public static final String SPEED = "speed";
    public static final String CHANNELS = "channels";

    private static final ColumnSpec ID_COLUMN = ColumnSpec.of(ID, SqlType.BIGINT);

    private MarkerSpectrumSchema() {}

    /**
     * Full spectrum rows, channels normalized to arrays and {@code created_at} mapped from epoch
     * seconds.
     *
     * @return spectrum descriptor
     */
    public static EntityDescriptor spectra() {
        return EntityDescriptor.builder()
                .table(SPECTRA)
                .key(ID_COLUMN)
                .column(ColumnSpec.of("marker_id", SqlType.BIGINT))
                .column(ColumnSpec.of(CHANNELS, SqlType.DOUBLE_ARRAY, new ChannelArrayTransform()))
                .column(ColumnSpec.of("channel_count", SqlType.INTEGER))
                .column(ColumnSpec.of("energy_min_kev", SqlType.DOUBLE))
                .column(ColumnSpec.of("energy_max_kev", SqlType.DOUBLE))
                .column(ColumnSpec.of("live_time_sec", SqlType.DOUBLE))
                .column(ColumnSpec.of("real_time_sec", SqlType.DOUBLE))
                .column(ColumnSpec.of("device_model", SqlType.TEXT))
                .column(ColumnSpec.of("calibration", SqlType.TEXT))
                .column(ColumnSpec.of("source_format", SqlType.TEXT))
                .column(ColumnSpec.of("filename", SqlType.TEXT))
                .column(ColumnSpec.of("raw_data", SqlType.BINARY))
                .column(ColumnSpec.of("created_at", SqlType.TIMESTAMP,
                        new EpochTimestampTransform()))
                .build();
    }

    /**
     * Channel data of spectra that have channels in the source.
     *
     * @return channel refresh descriptor
     */
    public static EntityDescriptor channels() {
        return EntityDescriptor.builder()
                .table(SPECTRA)
                .key(ID_COLUMN)
                .column(ColumnSpec.of(CHANNELS, SqlType.DOUBLE_ARRAY, new ChannelArrayTransform()))
                .column(ColumnSpec.of("channel_count", SqlType.INTEGER))
                .column(ColumnSpec.of("energy_min_kev", SqlType.DOUBLE))
                .column(ColumnSpec.of("energy_max_kev", SqlType.DOUBLE))
                .column(ColumnSpec.of("live_time_sec", SqlType.DOUBLE))
                .column(ColumnSpec.of("real_time_sec", SqlType.DOUBLE))
                .sourceFilter(CHANNELS + " IS NOT NULL")
                .build();
    }

    /**
     * Spectrum flag of markers flagged in the source.
     *
     * @param sourceDialect dialect of the source store
     * @return flag descriptor
     */
    public static EntityDescriptor spectrumFlags(StoreDialect sourceDialect) {
        return EntityDescriptor.builder()
                .table(MARKERS)
                .key(ID_COLUMN)
                .column(ColumnSpec.of(HAS_SPECTRUM, SqlType.BOOLEAN))
                .sourceFilter(flagged(sourceDialect))
                .build();
    }

    /**
     * Speed of markers with a positive speed in the source.
     *
     * @return speed descriptor
     */
    public static EntityDescriptor speed() {
        return EntityDescriptor.builder()
                .table(MARKERS)
                .key(ID_COLUMN)
                .column(ColumnSpec.of(SPEED, SqlType.DOUBLE))
                .sourceFilter(withSpeed())
                .build();
    }

    public static GuardCondition flagGuard() {
        return GuardCondition.nullOrFalse(HAS_SPECTRUM);
    }

    public static GuardCondition speedGuard() {
        return GuardCondition.nullOrZero(SPEED);
    }

    public static GuardCondition channelGuard() {
        return GuardCondition.isNull(CHANNELS);
    }

    /**
     * Predicate of markers flagged as having a spectrum.
     *
     * @param dialect dialect of the queried store
     * @return SQL predicate
     */
    public static String flagged(StoreDialect dialect) {
        return HAS_SPECTRUM + " = " + dialect.getBooleanTrueLiteral();
    }

    /**
     * Predicate of markers holding a positive speed.
     *
     * @return SQL predicate
     */
    public static String withSpeed() {
        return SPEED + " IS NOT NULL AND " + SPEED + " > 0";
    }

    /**
     * Predicate of spectra without channel data.
     *
     * @return SQL predicate
     */
    public static String withoutChannels() {
        return CHANNELS + " IS NULL";
    }
}
