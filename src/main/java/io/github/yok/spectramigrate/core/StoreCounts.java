package io.github.yok.spectramigrate.core;

import io.github.yok.spectramigrate.db.RelationalStore;
import java.sql.SQLException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Row counts of one store, taken before or after a run.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class StoreCounts {

    private final long markers;
    private final long spectra;
    private final long flaggedMarkers;
    private final long markersWithSpeed;
    private final long spectraWithoutChannels;

    /**
     * Counts the rows of a store.
     *
     * @param copier copier used for counting
     * @param store store to count
     * @return counts
     * @throws SQLException if a count query fails
     */
    public static StoreCounts of(ReconcilingCopier copier, RelationalStore store)
            throws SQLException {
        return new StoreCounts(
                copier.count(store, MarkerSpectrumSchema.MARKERS, null),
                copier.count(store, MarkerSpectrumSchema.SPECTRA, null),
                copier.count(store, MarkerSpectrumSchema.MARKERS,
                        MarkerSpectrumSchema.flagged(store.getDialect())),
                copier.count(store, MarkerSpectrumSchema.MARKERS, MarkerSpectrumSchema.withSpeed()),
                copier.count(store, MarkerSpectrumSchema.SPECTRA,
                        MarkerSpectrumSchema.withoutChannels()));
    }

    /**
     * Whether the store holds neither spectra nor speed values.
     *
     * @return true when there is nothing to migrate from this store
     */
    public boolean isNothingToMigrate() {
        return spectra == 0 && markersWithSpeed == 0;
    }
}
