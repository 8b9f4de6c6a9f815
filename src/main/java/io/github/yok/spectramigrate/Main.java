package io.github.yok.spectramigrate;

import io.github.yok.spectramigrate.config.MigrationConfig;
import io.github.yok.spectramigrate.config.MigrationMode;
import io.github.yok.spectramigrate.config.SourceConfig;
import io.github.yok.spectramigrate.config.TargetConfig;
import io.github.yok.spectramigrate.core.MigrationException;
import io.github.yok.spectramigrate.core.MigrationInteraction;
import io.github.yok.spectramigrate.core.MigrationOutcome;
import io.github.yok.spectramigrate.core.MigrationPhase;
import io.github.yok.spectramigrate.core.MigrationPlan;
import io.github.yok.spectramigrate.core.MigrationRunner;
import io.github.yok.spectramigrate.util.ConsolePrompt;
import io.github.yok.spectramigrate.util.ErrorHandler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, then invokes {@link MigrationRunner}.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --apply} or {@code -a} writes to the target.</li>
 * <li>{@code --dry-run} or {@code -n} only logs the migration plan (default, unless
 * {@code MIGRATION_MODE=apply}).</li>
 * <li>{@code --phases [p1,p2,…]} or {@code -p [p1,p2,…]} limits the run to the listed phases, for
 * example {@code spectra,speed}. If omitted, all phases run.</li>
 * </ul>
 *
 * <p>
 * Connection settings come from {@code application.yml}, which resolves the environment variables
 * {@code SQLITE_DB}, {@code PG_HOST}, {@code PG_PORT}, {@code PG_USER}, {@code PG_DB} and
 * {@code PG_PASSWORD}. A missing password is asked for on the console, and an apply run asks for
 * confirmation unless {@code migration.confirm-before-apply} is {@code false}.
 * </p>
 *
 * <p>
 * The process exits with {@code 0} on success, nothing to do, dry run, cancellation or warnings,
 * and with {@link ErrorHandler#EXIT_FAILURE} on a fatal error.
 * </p>
 *
 * @see SourceConfig
 * @see TargetConfig
 * @see MigrationConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({SourceConfig.class, TargetConfig.class, MigrationConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator, MigrationInteraction {

    private final SourceConfig sourceConfig;
    private final TargetConfig targetConfig;
    private final MigrationConfig migrationConfig;
    private final MigrationRunner runner;
    private final ConsolePrompt prompt;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the run's exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        MigrationMode mode = null;
        List<MigrationPhase> phases = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--apply":
                case "-a":
                    mode = MigrationMode.APPLY;
                    break;
                case "--dry-run":
                case "-n":
                    mode = MigrationMode.DRY_RUN;
                    break;
                case "--phases":
                case "-p":
                    if (i + 1 >= args.length) {
                        fail("Phase list is required after " + args[i] + ".");
                        return;
                    }
                    try {
                        phases = parsePhases(args[++i]);
                    } catch (IllegalArgumentException e) {
                        fail("Unknown phase in '" + args[i] + "'. Valid phases: "
                                + Arrays.toString(MigrationPhase.values()));
                        return;
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        if (mode != null) {
            migrationConfig.setMode(mode);
        }
        if (phases != null) {
            migrationConfig.setPhases(phases);
        }

        log.info("Mode: {}, Phases: {}, Source: {}, Target: {}:{}/{}", migrationConfig.getMode(),
                migrationConfig.getPhases(), sourceConfig.getSqlitePath(), targetConfig.getHost(),
                targetConfig.getPort(), targetConfig.getDatabase());

        // Execute
        try {
            MigrationOutcome outcome =
                    runner.run(sourceConfig, targetConfig, migrationConfig, this);
            exitCode = 0;
            log.info("Run finished: {}", outcome);
        } catch (MigrationException e) {
            exitCode = ErrorHandler.EXIT_FAILURE;
            ErrorHandler.fatal(e);
        } catch (UncheckedIOException e) {
            exitCode = ErrorHandler.EXIT_FAILURE;
            ErrorHandler.errorAndExit("Failed to read user input.", e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public String requestPassword(String user) {
        try {
            return prompt.readPassword("PostgreSQL password for " + user + ": ");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean confirm(MigrationPlan plan) {
        System.out.println(plan.describe());
        try {
            return prompt.confirm("Continue with migration?");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void fail(String message) {
        exitCode = ErrorHandler.EXIT_FAILURE;
        ErrorHandler.errorAndExit(message);
    }

    private static List<MigrationPhase> parsePhases(String value) {
        List<MigrationPhase> phases = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                phases.add(MigrationPhase.parse(part));
            }
        }
        if (phases.isEmpty()) {
            throw new IllegalArgumentException("Empty phase list");
        }
        return phases;
    }
}
