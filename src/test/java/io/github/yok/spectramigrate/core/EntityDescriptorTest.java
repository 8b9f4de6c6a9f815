package io.github.yok.spectramigrate.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.spectramigrate.db.SqlType;
import io.github.yok.spectramigrate.db.SqliteDialect;
import io.github.yok.spectramigrate.transform.ColumnTransform;
import org.junit.jupiter.api.Test;

class EntityDescriptorTest {

    @Test
    void allColumns_正常ケース_キーと列を指定する_キーが先頭に並ぶこと() {
        EntityDescriptor descriptor = MarkerSpectrumSchema.speed();
        assertEquals(2, descriptor.allColumns().size());
        assertEquals("id", descriptor.allColumns().get(0).getName());
        assertEquals("id, speed", descriptor.columnList());
        assertEquals("speed IS NOT NULL AND speed > 0", descriptor.getSourceFilter());
    }

    @Test
    void spectra_正常ケース_スペクトル定義を取得する_全14列で変換が設定されること() {
        EntityDescriptor descriptor = MarkerSpectrumSchema.spectra();
        assertEquals(14, descriptor.allColumns().size());
        assertNull(descriptor.getSourceFilter());
        for (ColumnSpec column : descriptor.allColumns()) {
            if ("channels".equals(column.getName())) {
                assertEquals(SqlType.DOUBLE_ARRAY, column.getType());
            } else if ("created_at".equals(column.getName())) {
                assertEquals(SqlType.TIMESTAMP, column.getType());
            } else {
                assertSame(ColumnTransform.IDENTITY, column.getTransform());
            }
        }
    }

    @Test
    void spectrumFlags_正常ケース_SQLite方言を指定する_1との比較条件になること() {
        assertEquals("has_spectrum = 1",
                MarkerSpectrumSchema.spectrumFlags(new SqliteDialect()).getSourceFilter());
    }

    @Test
    void builder_異常ケース_列を指定しない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> EntityDescriptor.builder()
                .table("markers").key(ColumnSpec.of("id", SqlType.BIGINT)).build());
        assertThrows(NullPointerException.class, () -> EntityDescriptor.builder()
                .table("markers").column(ColumnSpec.of("speed", SqlType.DOUBLE)).build());
    }

    @Test
    void phaseParse_正常ケース_ハイフン区切りを指定する_列挙値が返ること() {
        assertEquals(MigrationPhase.SPECTRUM_FLAGS, MigrationPhase.parse(" spectrum-flags "));
        assertEquals(MigrationPhase.SEQUENCES, MigrationPhase.parse("Sequences"));
        assertThrows(IllegalArgumentException.class, () -> MigrationPhase.parse("markers"));
        assertThrows(IllegalArgumentException.class, () -> MigrationPhase.parse(null));
    }
}
