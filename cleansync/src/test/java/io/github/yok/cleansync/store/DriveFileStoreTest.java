package io.github.yok.cleansync.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.cleansync.config.StoreConfig;
import io.github.yok.cleansync.exception.AuthException;
import io.github.yok.cleansync.exception.DownloadException;
import io.github.yok.cleansync.exception.ListException;
import io.github.yok.cleansync.exception.UploadException;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class DriveFileStoreTest {

    @TempDir
    Path tempDir;

    private HttpClient httpClient;

    private DriveFileStore store;

    @BeforeEach
    void setup() {
        httpClient = mock(HttpClient.class);
        StoreConfig.Drive settings = new StoreConfig.Drive();
        settings.setApiBaseUrl("https://drive.example/v3");
        settings.setUploadBaseUrl("https://drive.example/upload/v3");
        store = new DriveFileStore(httpClient, new ObjectMapper(), settings, () -> "tok");
    }

    @SuppressWarnings("unchecked")
    private static <T> HttpResponse<T> response(int status, T body) {
        HttpResponse<T> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    private List<HttpRequest> sentRequests(int count) throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(count)).send(captor.capture(), any());
        return captor.getAllValues();
    }

    private static String decodedUri(HttpRequest request) {
        return URLDecoder.decode(request.uri().toString(), StandardCharsets.UTF_8);
    }

    @Test
    void buildQuery_正常ケース_各条件を指定する_Drive検索式が返ること() {
        assertEquals("'root' in parents and trashed=false",
                store.buildQuery("root", ItemQuery.all()));
        assertEquals("'root' in parents and trashed=false"
                + " and mimeType!='application/vnd.google-apps.folder'",
                store.buildQuery("root", ItemQuery.filesOnly()));
        assertEquals("'root' in parents and trashed=false"
                + " and mimeType='application/vnd.google-apps.folder' and name='data_cleaned'",
                store.buildQuery("root", ItemQuery.folderNamed("data_cleaned")));
    }

    @Test
    void buildQuery_正常ケース_引用符を含む名前を指定する_エスケープされること() {
        assertEquals("'root' in parents and trashed=false and name='it\\'s a\\\\b.csv'",
                store.buildQuery("root", ItemQuery.named("it's a\\b.csv")));
    }

    @Test
    void listChildren_正常ケース_複数ページを指定する_全ページの項目が返ること() throws Exception {
        HttpResponse<String> page1 = response(200, "{\"nextPageToken\":\"p2\",\"files\":["
                + "{\"id\":\"1\",\"name\":\"a.csv\",\"modifiedTime\":\"2026-10-19T10:00:00.000Z\","
                + "\"mimeType\":\"text/csv\"},"
                + "{\"id\":\"2\",\"name\":\"b.csv\",\"mimeType\":\"text/csv\"}]}");
        HttpResponse<String> page2 = response(200,
                "{\"files\":[{\"id\":\"3\",\"name\":\"c.csv\",\"mimeType\":\"text/csv\"}]}");
        doReturn(page1, page2).when(httpClient).send(any(HttpRequest.class), any());

        List<RemoteItem> items = store.listChildren("root", ItemQuery.filesOnly());

        assertEquals(List.of("1", "2", "3"),
                items.stream().map(RemoteItem::getId).collect(Collectors.toList()));
        assertEquals("2026-10-19T10:00:00.000Z", items.get(0).getModifiedTime());
        assertEquals(null, items.get(1).getModifiedTime());

        List<HttpRequest> requests = sentRequests(2);
        assertEquals("GET", requests.get(0).method());
        assertEquals("Bearer tok", requests.get(0).headers().firstValue("Authorization").get());
        assertTrue(decodedUri(requests.get(0)).startsWith("https://drive.example/v3/files?q="
                + "'root' in parents and trashed=false"));
        assertTrue(decodedUri(requests.get(1)).contains("pageToken=p2"));
    }

    @Test
    void listChildren_異常ケース_HTTP401を受信する_AuthExceptionが送出されること()
            throws Exception {
        HttpResponse<String> unauthorized = response(401, "{\"error\":\"invalid_token\"}");
        doReturn(unauthorized).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(AuthException.class, () -> store.listChildren("root", ItemQuery.all()));
    }

    @Test
    void listChildren_異常ケース_HTTP500を受信する_ListExceptionが送出されること()
            throws Exception {
        HttpResponse<String> error = response(500, "backend error");
        doReturn(error).when(httpClient).send(any(HttpRequest.class), any());

        ListException ex =
                assertThrows(ListException.class, () -> store.listChildren("root", ItemQuery.all()));
        assertTrue(ex.getMessage().contains("HTTP 500"));
        assertTrue(ex.getMessage().contains("backend error"));
    }

    @Test
    void listChildren_異常ケース_通信エラーが発生する_ListExceptionが送出されること()
            throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient)
                .send(any(HttpRequest.class), any());

        ListException ex =
                assertThrows(ListException.class, () -> store.listChildren("root", ItemQuery.all()));
        assertTrue(ex.getCause() instanceof IOException);
    }

    @Test
    void ensureSubfolder_正常ケース_既存フォルダがある_作成せずIDが返ること() throws Exception {
        HttpResponse<String> found = response(200, "{\"files\":[{\"id\":\"f1\","
                + "\"name\":\"data_cleaned\",\"mimeType\":\"application/vnd.google-apps.folder\"}]}");
        doReturn(found).when(httpClient).send(any(HttpRequest.class), any());

        assertEquals("f1", store.ensureSubfolder("root", "data_cleaned"));
        sentRequests(1);
    }

    @Test
    void ensureSubfolder_正常ケース_フォルダがない_作成されたIDが返ること() throws Exception {
        HttpResponse<String> empty = response(200, "{\"files\":[]}");
        HttpResponse<String> created = response(200, "{\"id\":\"new-folder\"}");
        doReturn(empty, created).when(httpClient).send(any(HttpRequest.class), any());

        assertEquals("new-folder", store.ensureSubfolder("root", "data_cleaned"));

        HttpRequest create = sentRequests(2).get(1);
        assertEquals("POST", create.method());
        assertTrue(create.uri().toString().startsWith("https://drive.example/v3/files?"));
    }

    @Test
    void download_異常ケース_HTTP404を受信する_DownloadExceptionが送出されること()
            throws Exception {
        HttpResponse<Path> notFound = response(404, null);
        doReturn(notFound).when(httpClient).send(any(HttpRequest.class), any());
        RemoteItem item = new RemoteItem("abc", "a.csv", null, "text/csv");

        DownloadException ex = assertThrows(DownloadException.class,
                () -> store.download(item, tempDir.resolve("a.csv")));
        assertTrue(ex.getMessage().contains("HTTP 404"));

        HttpRequest request = sentRequests(1).get(0);
        assertEquals("https://drive.example/v3/files/abc?alt=media&supportsAllDrives=true",
                request.uri().toString());
    }

    @Test
    void createOrOverwrite_正常ケース_既存IDを指定する_PATCHで上書きされIDが維持されること()
            throws Exception {
        Path local = tempDir.resolve("a_cleaned.csv");
        Files.writeString(local, "a\n1\n", StandardCharsets.UTF_8);
        HttpResponse<String> ok = response(200, "{\"id\":\"dst-1\"}");
        doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

        assertEquals("dst-1", store.createOrOverwrite("cleaned", local, "a_cleaned.csv", "dst-1"));

        HttpRequest request = sentRequests(1).get(0);
        assertEquals("PATCH", request.method());
        assertTrue(request.uri().toString()
                .startsWith("https://drive.example/upload/v3/files/dst-1?uploadType=media"));
    }

    @Test
    void createOrOverwrite_正常ケース_既存IDなしを指定する_マルチパートで作成されること()
            throws Exception {
        Path local = tempDir.resolve("a_cleaned.csv");
        Files.writeString(local, "a\n1\n", StandardCharsets.UTF_8);
        HttpResponse<String> ok = response(200, "{\"id\":\"dst-2\"}");
        doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

        assertEquals("dst-2", store.createOrOverwrite("cleaned", local, "a_cleaned.csv", null));

        HttpRequest request = sentRequests(1).get(0);
        assertEquals("POST", request.method());
        assertTrue(request.uri().toString().contains("uploadType=multipart"));
        assertTrue(request.headers().firstValue("Content-Type").get()
                .startsWith("multipart/related; boundary="));
    }

    @Test
    void createOrOverwrite_異常ケース_応答にIDがない_UploadExceptionが送出されること()
            throws Exception {
        Path local = tempDir.resolve("a_cleaned.csv");
        Files.writeString(local, "a\n1\n", StandardCharsets.UTF_8);
        HttpResponse<String> ok = response(200, "{}");
        doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(UploadException.class,
                () -> store.createOrOverwrite("cleaned", local, "a_cleaned.csv", null));
    }

    @Test
    void createOrOverwrite_異常ケース_ローカルファイルがない_UploadExceptionが送出されること() {
        assertThrows(UploadException.class, () -> store.createOrOverwrite("cleaned",
                tempDir.resolve("missing.csv"), "missing_cleaned.csv", null));
    }
}
