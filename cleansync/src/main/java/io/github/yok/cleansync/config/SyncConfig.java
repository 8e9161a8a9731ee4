package io.github.yok.cleansync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code sync} section in {@code application.yml}.
 *
 * <p>
 * Values given on the command line ({@code --folder-id}, {@code --credentials},
 * {@code --run-today-only}, {@code --tz}) take precedence over the values held here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncConfig {

    /**
     * Identifier of the root container holding the raw CSV files.
     */
    private String rootFolderId;

    /**
     * Path of the credentials file handed to the remote file store.
     */
    private String credentials = "credentials.json";

    /**
     * When {@code true}, only files modified today (in {@link #timezone}) are considered.
     */
    private boolean runTodayOnly = true;

    /**
     * Time zone name used to decide what "today" means.
     */
    private String timezone = "America/New_York";

    /**
     * Name of the destination sub-container created under the root container.
     */
    private String cleanedFolderName = "data_cleaned";

    /**
     * Name of the audit log item kept in the destination container.
     */
    private String logName = "_pipeline_log.csv";

    /**
     * Suffix appended to the base name of a source file to form its destination name.
     */
    private String cleanedSuffix = "_cleaned.csv";
}
