package io.github.yok.spectramigrate.core;

import static io.github.yok.spectramigrate.core.SqliteTestSupport.insertMarker;
import static io.github.yok.spectramigrate.core.SqliteTestSupport.insertSpectrum;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.spectramigrate.db.RelationalStore;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrationVerifierTest {

    @TempDir
    Path tempDir;

    private RelationalStore target;
    private final MigrationVerifier verifier = new MigrationVerifier(new ReconcilingCopier());

    @BeforeEach
    void setup() throws Exception {
        target = SqliteTestSupport.create(tempDir.resolve("target.sqlite"), "target");
        for (long id = 1; id <= 100; id++) {
            insertMarker(target, id, id <= 10 ? 1 : 0, id <= 99 ? 12.0 : null);
        }
        insertSpectrum(target, 1, 1, "[1]");
        insertSpectrum(target, 2, 2, "[2]");
    }

    @AfterEach
    void teardown() {
        target.close();
    }

    @Test
    void verify_正常ケース_移行先が移行元以上_警告なしで返ること() throws Exception {
        VerificationReport report =
                verifier.verify(new StoreCounts(100, 2, 10, 99, 0), target, 0.01);

        assertTrue(report.isClean());
        assertEquals(99L, report.getTarget().getMarkersWithSpeed());
    }

    @Test
    void verify_正常ケース_速度の欠損が許容範囲内_警告なしで返ること() throws Exception {
        // 100 件中 99 件 = 1% の欠損
        VerificationReport report =
                verifier.verify(new StoreCounts(100, 2, 10, 100, 0), target, 0.01);

        assertTrue(report.isClean());
    }

    @Test
    void verify_異常ケース_スペクトルとフラグが不足する_それぞれ警告が返ること() throws Exception {
        VerificationReport report =
                verifier.verify(new StoreCounts(100, 3, 11, 99, 0), target, 0.01);

        assertEquals(2, report.getWarnings().size());
        assertEquals("Spectra: target has 2, source has 3", report.getWarnings().get(0));
        assertEquals("Spectrum flags: target has 10, source has 11",
                report.getWarnings().get(1));
    }

    @Test
    void verify_異常ケース_速度の欠損が許容範囲を超える_警告が返ること() throws Exception {
        VerificationReport report =
                verifier.verify(new StoreCounts(100, 2, 10, 200, 0), target, 0.01);

        assertEquals(1, report.getWarnings().size());
        assertTrue(report.getWarnings().get(0).startsWith("Speed: target has 99, source has 200"));
    }
}
