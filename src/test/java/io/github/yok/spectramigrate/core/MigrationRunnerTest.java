package io.github.yok.spectramigrate.core;

import static io.github.yok.spectramigrate.core.SqliteTestSupport.insertMarker;
import static io.github.yok.spectramigrate.core.SqliteTestSupport.insertSpectrum;
import static io.github.yok.spectramigrate.core.SqliteTestSupport.queryLong;
import static io.github.yok.spectramigrate.core.SqliteTestSupport.queryValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.spectramigrate.config.MigrationConfig;
import io.github.yok.spectramigrate.config.MigrationMode;
import io.github.yok.spectramigrate.config.SourceConfig;
import io.github.yok.spectramigrate.config.TargetConfig;
import io.github.yok.spectramigrate.db.RelationalStore;
import io.github.yok.spectramigrate.db.StoreConnector;
import java.nio.file.Path;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class MigrationRunnerTest {

    @TempDir
    Path tempDir;

    private Path sourceFile;
    private Path targetFile;
    private SourceConfig sourceConfig;
    private TargetConfig targetConfig;
    private MigrationConfig migrationConfig;
    private StoreConnector connector;
    private MigrationInteraction interaction;
    private MigrationRunner runner;

    @BeforeEach
    void setup() throws Exception {
        sourceFile = tempDir.resolve("source.sqlite");
        targetFile = tempDir.resolve("target.sqlite");

        // 移行元: マーカー 1..4、スペクトル 1..3（id=2 は移行先に既存）
        try (RelationalStore source = SqliteTestSupport.create(sourceFile, "source")) {
            insertMarker(source, 1, 1, 55.3);
            insertMarker(source, 2, 1, null);
            insertMarker(source, 3, 0, 20.0);
            insertMarker(source, 4, 1, 7.5);
            insertSpectrum(source, 1, 1, "[1, 2, 3]");
            insertSpectrum(source, 2, 2, "[4, 5, 6]");
            insertSpectrum(source, 3, 4, "[7, 8, 9]");
        }
        try (RelationalStore target = SqliteTestSupport.create(targetFile, "target")) {
            insertMarker(target, 1, 0, null);
            insertMarker(target, 2, 1, null);
            insertMarker(target, 3, 0, 10.0);
            insertMarker(target, 4, null, 0.0);
            insertSpectrum(target, 2, 2, null);
        }

        sourceConfig = new SourceConfig();
        sourceConfig.setSqlitePath(sourceFile.toString());
        targetConfig = new TargetConfig();
        targetConfig.setPassword("configured");
        migrationConfig = new MigrationConfig();
        migrationConfig.setMode(MigrationMode.APPLY);
        migrationConfig.setConfirmBeforeApply(false);

        connector = mock(StoreConnector.class);
        when(connector.openSource(any()))
                .thenAnswer(inv -> SqliteTestSupport.open(sourceFile, "source"));
        when(connector.openTarget(any(), any()))
                .thenAnswer(inv -> SqliteTestSupport.open(targetFile, "target"));
        interaction = mock(MigrationInteraction.class);

        ReconcilingCopier copier = new ReconcilingCopier();
        runner = new MigrationRunner(connector, copier, new MigrationVerifier(copier));
    }

    @Test
    void run_正常ケース_applyで全フェーズを実行する_移行先が移行元と整合すること() throws Exception {
        MigrationOutcome outcome =
                runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        assertEquals(MigrationOutcome.COMPLETED, outcome);
        try (RelationalStore target = SqliteTestSupport.open(targetFile, "check")) {
            assertEquals(3L, queryLong(target, "SELECT COUNT(*) FROM spectra"));
            assertEquals(3L,
                    queryLong(target, "SELECT COUNT(*) FROM markers WHERE has_spectrum = 1"));
            assertEquals(55.3, (Double) queryValue(target, "SELECT speed FROM markers WHERE id = 1"),
                    1e-9);
            assertEquals(10.0, (Double) queryValue(target, "SELECT speed FROM markers WHERE id = 3"),
                    1e-9);
            assertEquals(7.5, (Double) queryValue(target, "SELECT speed FROM markers WHERE id = 4"),
                    1e-9);
            // 既存スペクトルの channels は CHANNELS フェーズで補完される
            assertEquals("[4.0,5.0,6.0]",
                    queryValue(target, "SELECT channels FROM spectra WHERE id = 2"));
        }
        verify(interaction, never()).confirm(any());
        verify(interaction, never()).requestPassword(anyString());
    }

    @Test
    void run_正常ケース_2回実行する_2回目も同じ最終状態で完了すること() throws Exception {
        runner.run(sourceConfig, targetConfig, migrationConfig, interaction);
        MigrationOutcome second =
                runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        assertEquals(MigrationOutcome.COMPLETED, second);
        try (RelationalStore target = SqliteTestSupport.open(targetFile, "check")) {
            assertEquals(3L, queryLong(target, "SELECT COUNT(*) FROM spectra"));
            assertEquals(3L, queryLong(target, "SELECT COUNT(*) FROM markers WHERE speed > 0"));
        }
    }

    @Test
    void run_正常ケース_dry_runを指定する_計画のみで移行先が変更されないこと() throws Exception {
        migrationConfig.setMode(MigrationMode.DRY_RUN);

        MigrationOutcome outcome =
                runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        assertEquals(MigrationOutcome.DRY_RUN, outcome);
        try (RelationalStore target = SqliteTestSupport.open(targetFile, "check")) {
            assertEquals(1L, queryLong(target, "SELECT COUNT(*) FROM spectra"));
            assertEquals(1L, queryLong(target, "SELECT COUNT(*) FROM markers WHERE speed > 0"));
        }
    }

    @Test
    void run_正常ケース_確認でnoと回答する_CANCELLEDで移行先が変更されないこと() throws Exception {
        migrationConfig.setConfirmBeforeApply(true);
        when(interaction.confirm(any())).thenReturn(false);

        MigrationOutcome outcome =
                runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        assertEquals(MigrationOutcome.CANCELLED, outcome);
        ArgumentCaptor<MigrationPlan> plan = ArgumentCaptor.forClass(MigrationPlan.class);
        verify(interaction).confirm(plan.capture());
        assertEquals(2L, plan.getValue().getMissingSpectra());
        assertEquals(2L, plan.getValue().getMissingSpeeds());
        try (RelationalStore target = SqliteTestSupport.open(targetFile, "check")) {
            assertEquals(1L, queryLong(target, "SELECT COUNT(*) FROM spectra"));
        }
    }

    @Test
    void run_正常ケース_パスワード未設定_入力されたパスワードで接続すること() throws Exception {
        targetConfig.setPassword("");
        migrationConfig.setMode(MigrationMode.DRY_RUN);
        when(interaction.requestPassword("safecast")).thenReturn("typed");

        runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        verify(connector).openTarget(targetConfig, "typed");
    }

    @Test
    void run_正常ケース_フェーズを限定する_指定フェーズのみ実行されること() throws Exception {
        migrationConfig.setPhases(List.of(MigrationPhase.SPEED));

        runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        try (RelationalStore target = SqliteTestSupport.open(targetFile, "check")) {
            assertEquals(1L, queryLong(target, "SELECT COUNT(*) FROM spectra"));
            assertEquals(3L, queryLong(target, "SELECT COUNT(*) FROM markers WHERE speed > 0"));
        }
    }

    @Test
    void run_正常ケース_移行元にスペクトルも速度もない_移行先へ接続せずNOTHING_TO_DOになること()
            throws Exception {
        try (RelationalStore source = SqliteTestSupport.open(sourceFile, "source");
                Statement st = source.getConnection().createStatement()) {
            st.execute("DELETE FROM spectra");
            st.execute("UPDATE markers SET speed = NULL");
        }

        MigrationOutcome outcome =
                runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        assertEquals(MigrationOutcome.NOTHING_TO_DO, outcome);
        verify(connector, never()).openTarget(any(), any());
    }

    @Test
    void run_正常ケース_変換できない行がある_警告付きで完了すること() throws Exception {
        try (RelationalStore source = SqliteTestSupport.open(sourceFile, "source");
                Statement st = source.getConnection().createStatement()) {
            st.execute("UPDATE spectra SET channels = '[1, 2,' WHERE id = 3");
        }

        MigrationOutcome outcome =
                runner.run(sourceConfig, targetConfig, migrationConfig, interaction);

        assertEquals(MigrationOutcome.COMPLETED_WITH_WARNINGS, outcome);
    }

    @Test
    void run_異常ケース_移行元のテーブルがない_PRE_FLIGHTが送出されること() throws Exception {
        Path empty = tempDir.resolve("empty.sqlite");
        SqliteTestSupport.open(empty, "source").close();
        when(connector.openSource(any())).thenAnswer(inv -> SqliteTestSupport.open(empty, "x"));

        MigrationException ex = assertThrows(MigrationException.class,
                () -> runner.run(sourceConfig, targetConfig, migrationConfig, interaction));

        assertEquals(MigrationException.Kind.PRE_FLIGHT, ex.getKind());
        assertTrue(ex.getMessage().contains("x"));
    }

    @Test
    void run_異常ケース_移行元が見つからない_SOURCE_NOT_FOUNDがそのまま送出されること() {
        when(connector.openSource(any())).thenThrow(new MigrationException(
                MigrationException.Kind.SOURCE_NOT_FOUND, "SQLite database not found"));

        MigrationException ex = assertThrows(MigrationException.class,
                () -> runner.run(sourceConfig, targetConfig, migrationConfig, interaction));

        assertEquals(MigrationException.Kind.SOURCE_NOT_FOUND, ex.getKind());
    }

    @Test
    void run_異常ケース_フェーズ実行中にSQLエラー_PHASE_FAILEDが送出されること() throws Exception {
        try (RelationalStore target = SqliteTestSupport.open(targetFile, "target");
                Statement st = target.getConnection().createStatement()) {
            st.execute("CREATE TRIGGER no_speed BEFORE UPDATE OF speed ON markers "
                    + "BEGIN SELECT RAISE(ABORT, 'speed is locked'); END");
        }

        MigrationException ex = assertThrows(MigrationException.class,
                () -> runner.run(sourceConfig, targetConfig, migrationConfig, interaction));

        assertEquals(MigrationException.Kind.PHASE_FAILED, ex.getKind());
        try (RelationalStore target = SqliteTestSupport.open(targetFile, "check")) {
            // SPECTRA と SPECTRUM_FLAGS は確定済み
            assertEquals(3L, queryLong(target, "SELECT COUNT(*) FROM spectra"));
            assertEquals(1L, queryLong(target, "SELECT COUNT(*) FROM markers WHERE speed > 0"));
        }
    }
}
