package io.github.yok.spectramigrate.core;

import io.github.yok.spectramigrate.config.MigrationConfig;
import io.github.yok.spectramigrate.config.MigrationMode;
import io.github.yok.spectramigrate.config.SourceConfig;
import io.github.yok.spectramigrate.config.TargetConfig;
import io.github.yok.spectramigrate.db.RelationalStore;
import io.github.yok.spectramigrate.db.StoreConnector;
import io.github.yok.spectramigrate.db.StoreDialect;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Runs one migration from the SQLite source to the PostgreSQL target.
 *
 * <p>
 * Steps:
 * </p>
 * <ol>
 * <li>Open the source and count it. A source without spectra and speed values ends the run as
 * {@link MigrationOutcome#NOTHING_TO_DO} before the target is contacted.</li>
 * <li>Open the target (asking for the password when none is configured) and log the
 * {@link MigrationPlan}.</li>
 * <li>In {@link MigrationMode#DRY_RUN}, stop here.</li>
 * <li>Otherwise ask for confirmation when configured, run the selected phases in declaration order
 * and verify the result.</li>
 * </ol>
 *
 * <p>
 * Fatal failures are raised as {@link MigrationException}; both connections are closed in every
 * case.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationRunner {

    private final StoreConnector connector;
    private final ReconcilingCopier copier;
    private final MigrationVerifier verifier;

    /**
     * Executes a run.
     *
     * @param sourceConfig source settings
     * @param targetConfig target settings
     * @param migrationConfig mode, phases and batch sizes
     * @param interaction password and confirmation callbacks
     * @return how the run ended
     * @throws MigrationException on any fatal failure
     */
    public MigrationOutcome run(SourceConfig sourceConfig, TargetConfig targetConfig,
            MigrationConfig migrationConfig, MigrationInteraction interaction) {
        try (RelationalStore source = connector.openSource(sourceConfig)) {
            StoreCounts sourceCounts = countStore(source);
            if (sourceCounts.isNothingToMigrate()) {
                log.info("Source holds no spectra and no speed values; nothing to migrate");
                return MigrationOutcome.NOTHING_TO_DO;
            }

            String password = targetConfig.getPassword();
            if (StringUtils.isEmpty(password)) {
                password = interaction.requestPassword(targetConfig.getUser());
            }

            try (RelationalStore target = connector.openTarget(targetConfig, password)) {
                List<MigrationPhase> phases = List.copyOf(orderedPhases(migrationConfig));
                MigrationPlan plan = new MigrationPlan(migrationConfig.getMode(), phases,
                        sourceCounts, countStore(target));
                log.info("{}", plan.describe());

                if (migrationConfig.getMode() == MigrationMode.DRY_RUN) {
                    log.info("Dry run: no changes written. Re-run with --apply to migrate.");
                    return MigrationOutcome.DRY_RUN;
                }
                if (migrationConfig.isConfirmBeforeApply() && !interaction.confirm(plan)) {
                    log.info("Migration cancelled by user");
                    return MigrationOutcome.CANCELLED;
                }

                for (MigrationPhase phase : phases) {
                    runPhase(phase, source, target, migrationConfig);
                }

                return verify(sourceCounts, target, migrationConfig.getSpeedTolerance());
            }
        }
    }

    private void runPhase(MigrationPhase phase, RelationalStore source, RelationalStore target,
            MigrationConfig config) {
        log.info("=== Phase {} ===", phase);
        switch (phase) {
            case SPECTRA:
                copier.copyMissing(source, target, MarkerSpectrumSchema.spectra(),
                        config.getInsertBatchSize(), config.getInsertProgressInterval());
                break;
            case SPECTRUM_FLAGS:
                copier.updateColumns(source, target,
                        MarkerSpectrumSchema.spectrumFlags(source.getDialect()),
                        MarkerSpectrumSchema.flagGuard(), config.getFlagBatchSize());
                break;
            case SPEED:
                copier.updateColumns(source, target, MarkerSpectrumSchema.speed(),
                        MarkerSpectrumSchema.speedGuard(), config.getSpeedBatchSize());
                break;
            case CHANNELS:
                copier.updateColumns(source, target, MarkerSpectrumSchema.channels(),
                        MarkerSpectrumSchema.channelGuard(), config.getChannelBatchSize());
                break;
            case SEQUENCES:
                resetSequences(target);
                break;
            default:
                throw new IllegalStateException("Unknown phase: " + phase);
        }
    }

    private void resetSequences(RelationalStore target) {
        StoreDialect dialect = target.getDialect();
        if (!dialect.supportsSequences()) {
            log.info("[{}] No sequences to reset on {}", MarkerSpectrumSchema.SPECTRA,
                    dialect.getName());
            return;
        }
        try {
            long value = dialect.resetSequence(target.getConnection(),
                    MarkerSpectrumSchema.SPECTRA, MarkerSpectrumSchema.ID);
            if (value < 0) {
                log.info("[{}] Table has no id sequence", MarkerSpectrumSchema.SPECTRA);
            } else {
                log.info("[{}] Id sequence set to {}", MarkerSpectrumSchema.SPECTRA, value);
            }
        } catch (SQLException e) {
            throw new MigrationException(MigrationException.Kind.PHASE_FAILED,
                    "Sequence reset of " + MarkerSpectrumSchema.SPECTRA + " failed", e);
        }
    }

    private MigrationOutcome verify(StoreCounts sourceCounts, RelationalStore target,
            double speedTolerance) {
        VerificationReport report;
        try {
            report = verifier.verify(sourceCounts, target, speedTolerance);
        } catch (SQLException e) {
            log.warn("Verification could not be completed: {}", e.getMessage(), e);
            return MigrationOutcome.COMPLETED_WITH_WARNINGS;
        }
        if (report.isClean()) {
            log.info("Migration completed");
            return MigrationOutcome.COMPLETED;
        }
        log.warn("Migration completed with {} warning(s)", report.getWarnings().size());
        return MigrationOutcome.COMPLETED_WITH_WARNINGS;
    }

    private StoreCounts countStore(RelationalStore store) {
        try {
            StoreCounts counts = StoreCounts.of(copier, store);
            log.info("[{}] {}", store.getName(), counts);
            return counts;
        } catch (SQLException e) {
            throw new MigrationException(MigrationException.Kind.PRE_FLIGHT,
                    "Counting rows in the " + store.getName() + " store failed", e);
        }
    }

    private static EnumSet<MigrationPhase> orderedPhases(MigrationConfig config) {
        EnumSet<MigrationPhase> phases = EnumSet.noneOf(MigrationPhase.class);
        if (config.getPhases() != null) {
            phases.addAll(config.getPhases());
        }
        return phases;
    }
}
