package io.github.yok.cleansync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.cleansync.config.StoreConfig;
import io.github.yok.cleansync.exception.AuthException;
import io.github.yok.cleansync.exception.DownloadException;
import io.github.yok.cleansync.exception.ListException;
import io.github.yok.cleansync.exception.SyncException;
import io.github.yok.cleansync.exception.UploadException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link RemoteFileStore} backed by Google Drive, using the Drive v3 REST API.
 *
 * <p>
 * Containers are Drive folders and ids are Drive file ids. Listing follows
 * {@code nextPageToken} until every page is read and excludes trashed items. New files are created
 * with a multipart upload; existing files are overwritten in place with a media upload, which
 * keeps their id.
 * </p>
 *
 * <p>
 * HTTP 401 is reported as {@link AuthException}; any other non-2xx status is reported with the
 * exception type of the failed operation. No request is retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DriveFileStore implements RemoteFileStore {

    private static final String LIST_FIELDS =
            "nextPageToken,files(id,name,modifiedTime,mimeType)";

    private static final String CSV_MIME_TYPE = "text/csv";

    private final HttpClient httpClient;

    private final ObjectMapper objectMapper;

    private final StoreConfig.Drive settings;

    private final AccessTokenProvider tokenProvider;

    @Override
    public List<RemoteItem> listChildren(String containerId, ItemQuery query) {
        String q = buildQuery(containerId, query);
        String action = "list folder " + containerId;
        List<RemoteItem> items = new ArrayList<>();
        String pageToken = null;
        do {
            StringBuilder uri = new StringBuilder(settings.getApiBaseUrl()).append("/files?q=")
                    .append(encode(q)).append("&fields=").append(encode(LIST_FIELDS))
                    .append("&pageSize=1000&supportsAllDrives=true&includeItemsFromAllDrives=true");
            if (pageToken != null) {
                uri.append("&pageToken=").append(encode(pageToken));
            }
            JsonNode body = sendForJson(newRequest(uri.toString()).GET().build(),
                    ListException::new, action);
            for (JsonNode file : body.path("files")) {
                items.add(new RemoteItem(file.path("id").asText(), file.path("name").asText(),
                        file.path("modifiedTime").asText(null),
                        file.path("mimeType").asText(null)));
            }
            pageToken = body.path("nextPageToken").asText(null);
        } while (StringUtils.isNotEmpty(pageToken));
        log.debug("Listed {} item(s) in folder {} (q={})", items.size(), containerId, q);
        return items;
    }

    @Override
    public String ensureSubfolder(String containerId, String name) {
        List<RemoteItem> existing = listChildren(containerId, ItemQuery.folderNamed(name));
        if (!existing.isEmpty()) {
            return existing.get(0).getId();
        }
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("name", name);
        metadata.put("mimeType", RemoteItem.FOLDER_MIME_TYPE);
        metadata.putArray("parents").add(containerId);
        HttpRequest request =
                newRequest(settings.getApiBaseUrl() + "/files?supportsAllDrives=true&fields=id")
                        .header("Content-Type", "application/json; charset=UTF-8")
                        .POST(HttpRequest.BodyPublishers.ofString(metadata.toString()))
                        .build();
        String id = sendForJson(request, ListException::new, "create folder " + name)
                .path("id").asText();
        log.info("Created folder '{}' ({}) in {}", name, id, containerId);
        return id;
    }

    @Override
    public void download(RemoteItem item, Path target) {
        HttpRequest request = newRequest(settings.getApiBaseUrl() + "/files/"
                + encode(item.getId()) + "?alt=media&supportsAllDrives=true").GET().build();
        send(request, HttpResponse.BodyHandlers.ofFile(target), DownloadException::new,
                "download " + item.getTitle());
    }

    @Override
    public String createOrOverwrite(String containerId, Path source, String title,
            String existingId) {
        String action = (existingId != null ? "overwrite " : "create ") + title;
        HttpRequest request;
        try {
            if (existingId != null) {
                request = newRequest(settings.getUploadBaseUrl() + "/files/" + encode(existingId)
                        + "?uploadType=media&supportsAllDrives=true&fields=id")
                                .header("Content-Type", CSV_MIME_TYPE)
                                .method("PATCH", HttpRequest.BodyPublishers.ofFile(source))
                                .build();
            } else {
                String boundary = "cleansync-" + UUID.randomUUID();
                request = newRequest(settings.getUploadBaseUrl()
                        + "/files?uploadType=multipart&supportsAllDrives=true&fields=id")
                                .header("Content-Type",
                                        "multipart/related; boundary=" + boundary)
                                .POST(HttpRequest.BodyPublishers.ofByteArray(
                                        multipartBody(boundary, containerId, source, title)))
                                .build();
            }
        } catch (IOException e) {
            throw new UploadException("Cannot " + action + ": " + e.getMessage(), e);
        }
        String id = sendForJson(request, UploadException::new, action).path("id").asText(null);
        if (StringUtils.isEmpty(id)) {
            throw new UploadException("Cannot " + action + ": response carries no id");
        }
        return id;
    }

    /**
     * Builds the Drive search expression for a listing.
     *
     * @param containerId parent folder id
     * @param query filter
     * @return value of the {@code q} parameter
     */
    String buildQuery(String containerId, ItemQuery query) {
        StringBuilder q = new StringBuilder("'").append(escape(containerId))
                .append("' in parents and trashed=false");
        if (query.getMimeType() != null) {
            q.append(" and mimeType='").append(escape(query.getMimeType())).append("'");
        }
        if (query.isExcludeFolders()) {
            q.append(" and mimeType!='").append(RemoteItem.FOLDER_MIME_TYPE).append("'");
        }
        if (query.getTitle() != null) {
            q.append(" and name='").append(escape(query.getTitle())).append("'");
        }
        return q.toString();
    }

    private byte[] multipartBody(String boundary, String containerId, Path source, String title)
            throws IOException {
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("name", title);
        metadata.putArray("parents").add(containerId);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(("--" + boundary + "\r\n"
                + "Content-Type: application/json; charset=UTF-8\r\n\r\n" + metadata + "\r\n"
                + "--" + boundary + "\r\n" + "Content-Type: " + CSV_MIME_TYPE + "\r\n\r\n")
                        .getBytes(StandardCharsets.UTF_8));
        out.write(Files.readAllBytes(source));
        out.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    private HttpRequest.Builder newRequest(String uri) {
        return HttpRequest.newBuilder(URI.create(uri)).timeout(settings.getRequestTimeout())
                .header("Authorization", "Bearer " + tokenProvider.getAccessToken());
    }

    private JsonNode sendForJson(HttpRequest request,
            BiFunction<String, Throwable, ? extends SyncException> failure, String action) {
        HttpResponse<String> response =
                send(request, HttpResponse.BodyHandlers.ofString(), failure, action);
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw failure.apply("Cannot " + action + ": malformed response", e);
        }
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler,
            BiFunction<String, Throwable, ? extends SyncException> failure, String action) {
        HttpResponse<T> response;
        try {
            response = httpClient.send(request, handler);
        } catch (IOException e) {
            throw failure.apply("Cannot " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure.apply("Interrupted while trying to " + action, e);
        }
        int status = response.statusCode();
        log.debug("{} {} -> HTTP {}", request.method(), request.uri().getPath(), status);
        if (status == 401) {
            throw new AuthException("Drive rejected the access token (HTTP 401) on " + action);
        }
        if (status < 200 || status >= 300) {
            String detail = response.body() instanceof String
                    ? " " + StringUtils.abbreviate((String) response.body(), 200)
                    : "";
            throw failure.apply("Cannot " + action + ": HTTP " + status + detail, null);
        }
        return response;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
