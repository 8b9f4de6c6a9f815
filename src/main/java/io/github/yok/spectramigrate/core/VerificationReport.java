package io.github.yok.spectramigrate.core;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of the post-run count checks. Warnings never fail the run.
 */
@Getter
@RequiredArgsConstructor
public final class VerificationReport {

    private final StoreCounts source;
    private final StoreCounts target;
    private final List<String> warnings;

    public boolean isClean() {
        return warnings.isEmpty();
    }
}
