package io.github.yok.cleansync.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code store} section in {@code application.yml} and selects
 * the remote file store back end.
 *
 * <p>
 * <strong>Supported types:</strong>
 * </p>
 * <ul>
 * <li>{@link StoreType#LOCAL}: containers are directories under {@code store.local-base-path}</li>
 * <li>{@link StoreType#DRIVE}: containers are Google Drive folders</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "store")
@Data
public class StoreConfig {

    /**
     * Back end used for listing, downloading and uploading items.
     */
    private StoreType type = StoreType.DRIVE;

    /**
     * Base directory of the {@link StoreType#LOCAL} back end. Container ids are relative to it.
     */
    private String localBasePath = ".";

    /**
     * Settings of the {@link StoreType#DRIVE} back end.
     */
    private Drive drive = new Drive();

    /**
     * Endpoint and timeout settings for the Drive v3 REST API.
     */
    @Data
    public static class Drive {

        /**
         * Base URL of the metadata endpoints.
         */
        private String apiBaseUrl = "https://www.googleapis.com/drive/v3";

        /**
         * Base URL of the media upload endpoints.
         */
        private String uploadBaseUrl = "https://www.googleapis.com/upload/drive/v3";

        /**
         * Timeout applied to every HTTP request.
         */
        private Duration requestTimeout = Duration.ofSeconds(60);
    }
}
