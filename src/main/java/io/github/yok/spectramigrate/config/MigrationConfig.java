package io.github.yok.spectramigrate.config;

import io.github.yok.spectramigrate.core.MigrationPhase;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code migration} section in {@code application.yml}.
 *
 * <p>
 * <strong>Batch settings:</strong>
 * </p>
 * <ul>
 * <li>{@code insert-batch-size}: JDBC batch size for spectrum inserts (all inserts still share one
 * transaction)</li>
 * <li>{@code flag-batch-size}, {@code speed-batch-size}, {@code channel-batch-size}: rows per
 * committed batch of the conditional update phases</li>
 * </ul>
 *
 * <p>
 * {@code speed-tolerance} is the fraction of source speed values that may be missing in the target
 * before verification reports a warning.
 * </p>
 */
@ConfigurationProperties(prefix = "migration")
@Data
public class MigrationConfig {

    /**
     * Execution mode (environment variable {@code MIGRATION_MODE}).
     */
    private MigrationMode mode = MigrationMode.DRY_RUN;

    /**
     * When {@code true}, the user is asked for confirmation before an apply run writes anything.
     */
    private boolean confirmBeforeApply = true;

    /**
     * Phases to run, in execution order. Defaults to all phases.
     */
    private List<MigrationPhase> phases = new ArrayList<>(Arrays.asList(MigrationPhase.values()));

    /**
     * JDBC batch size used while inserting missing spectra.
     */
    private int insertBatchSize = 500;

    /**
     * Number of inserted spectra between two progress log lines.
     */
    private int insertProgressInterval = 100;

    /**
     * Rows per committed batch when setting spectrum flags.
     */
    private int flagBatchSize = 10_000;

    /**
     * Rows per committed batch when copying speed values.
     */
    private int speedBatchSize = 10_000;

    /**
     * Rows per committed batch when refreshing channel data.
     */
    private int channelBatchSize = 500;

    /**
     * Allowed fraction of missing speed values in the verification step.
     */
    private double speedTolerance = 0.01;
}
