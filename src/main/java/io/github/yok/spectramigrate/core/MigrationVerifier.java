package io.github.yok.spectramigrate.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.spectramigrate.db.RelationalStore;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compares target counts after a run with the source counts taken before it.
 *
 * <ul>
 * <li>spectra: target must hold at least as many as the source</li>
 * <li>spectrum flags: target must hold at least as many flagged markers as the source</li>
 * <li>speed: target must hold at least {@code source * (1 - tolerance)} markers with speed</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationVerifier {

    private final ReconcilingCopier copier;

    /**
     * Recounts the target and checks it against the source counts.
     *
     * @param source source counts taken before the run
     * @param target target store
     * @param speedTolerance allowed fraction of missing speed values
     * @return report with one warning per failed check
     * @throws SQLException if a count query fails
     */
    public VerificationReport verify(StoreCounts source, RelationalStore target,
            double speedTolerance) throws SQLException {
        StoreCounts after = StoreCounts.of(copier, target);
        ImmutableList.Builder<String> warnings = ImmutableList.builder();

        if (after.getSpectra() < source.getSpectra()) {
            warnings.add("Spectra: target has " + after.getSpectra() + ", source has "
                    + source.getSpectra());
        }
        if (after.getFlaggedMarkers() < source.getFlaggedMarkers()) {
            warnings.add("Spectrum flags: target has " + after.getFlaggedMarkers()
                    + ", source has " + source.getFlaggedMarkers());
        }
        double minimumSpeeds = source.getMarkersWithSpeed() * (1.0d - speedTolerance);
        if (after.getMarkersWithSpeed() < minimumSpeeds) {
            warnings.add(String.format("Speed: target has %d, source has %d (tolerance %.1f%%)",
                    after.getMarkersWithSpeed(), source.getMarkersWithSpeed(),
                    speedTolerance * 100));
        }

        VerificationReport report = new VerificationReport(source, after, warnings.build());
        log.info("Verification: spectra {}/{}, flags {}/{}, speed {}/{}", after.getSpectra(),
                source.getSpectra(), after.getFlaggedMarkers(), source.getFlaggedMarkers(),
                after.getMarkersWithSpeed(), source.getMarkersWithSpeed());
        if (report.isClean()) {
            log.info("Verification passed");
        } else {
            report.getWarnings().forEach(w -> log.warn("Verification: {}", w));
        }
        return report;
    }
}
