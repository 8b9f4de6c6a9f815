package io.github.yok.spectramigrate.core;

import io.github.yok.spectramigrate.config.MigrationMode;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Pre-flight view of a run: counts of both stores and the work they imply.
 */
@Getter
@RequiredArgsConstructor
public final class MigrationPlan {

    private final MigrationMode mode;
    private final List<MigrationPhase> phases;
    private final StoreCounts source;
    private final StoreCounts target;

    public long getMissingSpectra() {
        return delta(source.getSpectra(), target.getSpectra());
    }

    public long getMissingFlags() {
        return delta(source.getFlaggedMarkers(), target.getFlaggedMarkers());
    }

    public long getMissingSpeeds() {
        return delta(source.getMarkersWithSpeed(), target.getMarkersWithSpeed());
    }

    /**
     * Renders the plan for the log and the confirmation prompt.
     *
     * @return multi-line summary
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Migration plan (").append(mode).append(")\n");
        sb.append(String.format("  %-22s %12s %12s %12s%n", "", "source", "target", "missing"));
        line(sb, "markers", source.getMarkers(), target.getMarkers(),
                delta(source.getMarkers(), target.getMarkers()));
        line(sb, "spectra", source.getSpectra(), target.getSpectra(), getMissingSpectra());
        line(sb, "markers with spectrum", source.getFlaggedMarkers(),
                target.getFlaggedMarkers(), getMissingFlags());
        line(sb, "markers with speed", source.getMarkersWithSpeed(),
                target.getMarkersWithSpeed(), getMissingSpeeds());
        sb.append(String.format("  %-22s %12s %12d%n", "spectra w/o channels", "-",
                target.getSpectraWithoutChannels()));
        sb.append("  phases: ").append(phases);
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, long source, long target,
            long missing) {
        sb.append(String.format("  %-22s %12d %12d %12d%n", label, source, target, missing));
    }

    private static long delta(long source, long target) {
        return Math.max(0L, source - target);
    }
}
