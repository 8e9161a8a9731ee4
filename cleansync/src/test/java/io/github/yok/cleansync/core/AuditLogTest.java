package io.github.yok.cleansync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.cleansync.exception.ListException;
import io.github.yok.cleansync.store.InMemoryFileStore;
import io.github.yok.cleansync.store.RemoteItem;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuditLogTest {

    private static final String LOG = "_pipeline_log.csv";

    private static final String HEADER =
            "timestamp,src_id,src_title,src_modified,dst_id,dst_title,rows_in,rows_out,status,"
                    + "message\n";

    @TempDir
    Path workDir;

    private InMemoryFileStore store;

    private String cleanedId;

    private final RemoteItem source =
            new RemoteItem("src-1", "a.csv", "2026-10-19T14:00:00Z", "text/csv");

    @BeforeEach
    void setup() {
        store = new InMemoryFileStore();
        cleanedId = store.addFolder(InMemoryFileStore.ROOT, "data_cleaned");
    }

    @Test
    void load_正常ケース_ログが存在しない_ヘッダのみの作業ファイルが作成されること()
            throws Exception {
        AuditLog auditLog = AuditLog.load(store, cleanedId, LOG, workDir);

        assertTrue(auditLog.entries().isEmpty());
        assertEquals(HEADER, Files.readString(workDir.resolve(LOG), StandardCharsets.UTF_8));
    }

    @Test
    void flush_正常ケース_ログが存在しない_新規作成され追記行が出力されること() {
        AuditLog auditLog = AuditLog.load(store, cleanedId, LOG, workDir);
        auditLog.append(AuditLogEntry.succeeded("2026-10-19T15:00:00+00:00", source, "dst-1",
                "a_cleaned.csv", 2, 2));

        String id = auditLog.flush();

        assertEquals(id, store.child(cleanedId, LOG).orElseThrow().getId());
        assertEquals(HEADER + "2026-10-19T15:00:00+00:00,src-1,a.csv,2026-10-19T14:00:00Z,"
                + "dst-1,a_cleaned.csv,2,2,ok,\n", store.contentOf(cleanedId, LOG).orElseThrow());
    }

    @Test
    void flush_正常ケース_既存ログがある_既存行を保持して追記され同じIDで上書きされること() {
        String existingId = store.addFile(cleanedId, LOG, "2026-10-18T15:00:00Z", HEADER
                + "2026-10-18T15:00:00+00:00,src-0,old.csv,2026-10-18T14:00:00Z,dst-0,"
                + "old_cleaned.csv,5.0,5.0,ok,\n");
        AuditLog auditLog = AuditLog.load(store, cleanedId, LOG, workDir);
        assertEquals(1, auditLog.entries().size());

        auditLog.append(AuditLogEntry.failed("2026-10-19T15:00:00+00:00", source,
                "a_cleaned.csv", "Injected, with comma"));
        String id = auditLog.flush();

        assertEquals(existingId, id);
        assertEquals(1, auditLog.appendedCount());
        assertEquals(HEADER
                + "2026-10-18T15:00:00+00:00,src-0,old.csv,2026-10-18T14:00:00Z,dst-0,"
                + "old_cleaned.csv,5,5,ok,\n"
                + "2026-10-19T15:00:00+00:00,src-1,a.csv,2026-10-19T14:00:00Z,,a_cleaned.csv,,,"
                + "fail,\"Injected, with comma\"\n", store.contentOf(cleanedId, LOG).orElseThrow());
    }

    @Test
    void load_異常ケース_既存ログの取得に失敗する_ListExceptionが送出されること() {
        store.addFile(cleanedId, LOG, "2026-10-18T15:00:00Z", HEADER);
        store.failDownloadOf(LOG);

        assertThrows(ListException.class, () -> AuditLog.load(store, cleanedId, LOG, workDir));
    }

    @Test
    void entries_異常ケース_一覧を変更する_UnsupportedOperationExceptionが送出されること() {
        AuditLog auditLog = AuditLog.load(store, cleanedId, LOG, workDir);
        assertThrows(UnsupportedOperationException.class, () -> auditLog.entries().clear());
    }
}
