package io.github.yok.spectramigrate.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of {@link ReconcilingCopier#copyMissing}.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public final class CopyResult {

    // Rows inserted into the target
    private final long inserted;
    // Rows already present in the target
    private final long skipped;
    // Rows rejected by a column transform
    private final long failed;

    @Override
    public String toString() {
        String summary = inserted + " inserted, " + skipped + " skipped";
        return failed > 0 ? summary + ", " + failed + " failed" : summary;
    }
}
