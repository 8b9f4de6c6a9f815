package io.github.yok.spectramigrate.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RelationalStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void count_正常ケース_条件ありとなしで件数を取得する_一致件数が返ること() throws Exception {
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("c.db"));
        try (RelationalStore store = new RelationalStore("source", conn, new SqliteDialect())) {
            try (Statement st = conn.createStatement()) {
                st.execute("CREATE TABLE markers (id INTEGER PRIMARY KEY, speed REAL)");
                st.execute("INSERT INTO markers VALUES (1, NULL), (2, 3.5), (3, 0)");
            }
            assertEquals(3L, store.count("markers", null));
            assertEquals(3L, store.count("markers", " "));
            assertEquals(1L, store.count("markers", "speed > 0"));
        }
    }

    @Test
    void begin_commit_end_正常ケース_トランザクションを制御する_autoCommitが切り替わること() throws Exception {
        Connection conn = mock(Connection.class);
        RelationalStore store = new RelationalStore("target", conn, new SqliteDialect());

        store.begin();
        store.commit();
        store.end();

        verify(conn).setAutoCommit(false);
        verify(conn).commit();
        verify(conn).setAutoCommit(true);
    }

    @Test
    void rollback_正常ケース_トランザクション中_ロールバックされautoCommitへ戻ること() throws Exception {
        Connection conn = mock(Connection.class);
        when(conn.getAutoCommit()).thenReturn(false);
        RelationalStore store = new RelationalStore("target", conn, new SqliteDialect());

        store.rollback(new SQLException("boom"));

        verify(conn).rollback();
        verify(conn).setAutoCommit(true);
    }

    @Test
    void rollback_正常ケース_autoCommit中_ロールバックされないこと() throws Exception {
        Connection conn = mock(Connection.class);
        when(conn.getAutoCommit()).thenReturn(true);
        RelationalStore store = new RelationalStore("target", conn, new SqliteDialect());

        store.rollback(new SQLException("boom"));

        verify(conn, never()).rollback();
    }

    @Test
    void rollback_異常ケース_ロールバックに失敗する_抑制例外として付与されること() throws Exception {
        Connection conn = mock(Connection.class);
        SQLException rollbackFailure = new SQLException("connection lost");
        when(conn.getAutoCommit()).thenReturn(false);
        doThrow(rollbackFailure).when(conn).rollback();
        RelationalStore store = new RelationalStore("target", conn, new SqliteDialect());
        SQLException cause = new SQLException("boom");

        store.rollback(cause);

        assertEquals(1, cause.getSuppressed().length);
        assertSame(rollbackFailure, cause.getSuppressed()[0]);
    }

    @Test
    void close_異常ケース_クローズに失敗する_例外が送出されないこと() throws Exception {
        Connection conn = mock(Connection.class);
        doThrow(new SQLException("already closed")).when(conn).close();
        new RelationalStore("target", conn, new SqliteDialect()).close();
        verify(conn).close();
    }

    @Test
    void constructor_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class,
                () -> new RelationalStore("x", null, new SqliteDialect()));
    }
}
