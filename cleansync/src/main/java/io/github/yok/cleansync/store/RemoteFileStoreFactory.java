package io.github.yok.cleansync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.cleansync.config.StoreConfig;
import io.github.yok.cleansync.config.StoreType;
import io.github.yok.cleansync.exception.AuthException;
import java.net.http.HttpClient;
import java.nio.file.Paths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link RemoteFileStore} according to {@code store.type}.
 *
 * <ul>
 * <li>{@link StoreType#LOCAL}: instantiate {@link LocalDirectoryFileStore} on
 * {@code store.local-base-path}; credentials are not used</li>
 * <li>{@link StoreType#DRIVE}: instantiate {@link DriveFileStore} with a token read from the
 * credentials file</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteFileStoreFactory {

    // Store selection and Drive endpoint settings
    private final StoreConfig storeConfig;

    /**
     * Creates the configured store.
     *
     * @param credentials path of the credentials file (ignored by the local store)
     * @return a ready-to-use store
     * @throws AuthException if the Drive credentials cannot be loaded
     * @throws IllegalStateException if {@code store.type} is not set
     */
    public RemoteFileStore create(String credentials) {
        StoreType type = storeConfig.getType();
        if (type == null) {
            throw new IllegalStateException(
                    "store.type is not configured. Please set 'store.type' in application.yml.");
        }
        switch (type) {
            case LOCAL:
                log.info("Using local directory store at {}", storeConfig.getLocalBasePath());
                return new LocalDirectoryFileStore(Paths.get(storeConfig.getLocalBasePath()));
            case DRIVE:
            default:
                ObjectMapper objectMapper = new ObjectMapper();
                AccessTokenProvider tokenProvider =
                        CredentialsFileTokenProvider.load(Paths.get(credentials), objectMapper);
                HttpClient httpClient = HttpClient.newBuilder()
                        .connectTimeout(storeConfig.getDrive().getRequestTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL).build();
                log.info("Using Google Drive store at {}", storeConfig.getDrive().getApiBaseUrl());
                return new DriveFileStore(httpClient, objectMapper, storeConfig.getDrive(),
                        tokenProvider);
        }
    }
}
