package io.github.yok.spectramigrate.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of {@link ReconcilingCopier#updateColumns}.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public final class UpdateResult {

    // Committed batches
    private final int batches;
    // Source rows read
    private final long processed;
    // Target rows changed (rows the guard let through)
    private final long updated;
    // Source rows rejected by a column transform
    private final long failed;

    @Override
    public String toString() {
        return processed + " processed, " + updated + " updated in " + batches + " batch(es)"
                + (failed > 0 ? ", " + failed + " failed" : "");
    }
}
