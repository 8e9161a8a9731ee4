package io.github.yok.cleansync;

import io.github.yok.cleansync.config.PathsConfig;
import io.github.yok.cleansync.config.StoreConfig;
import io.github.yok.cleansync.config.SyncConfig;
import io.github.yok.cleansync.core.RunSummary;
import io.github.yok.cleansync.core.SyncOptions;
import io.github.yok.cleansync.core.SyncOrchestrator;
import io.github.yok.cleansync.store.RemoteFileStore;
import io.github.yok.cleansync.store.RemoteFileStoreFactory;
import io.github.yok.cleansync.util.ErrorHandler;
import io.github.yok.cleansync.util.TimestampParser;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, builds the configured remote file store and runs one
 * {@link SyncOrchestrator} pass. Options may be given as {@code --name value} or
 * {@code --name=value}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --folder-id <id>}: root container holding the raw CSV files. Required unless
 * {@code sync.root-folder-id} is set in {@code application.yml}.</li>
 * <li>{@code --credentials <path>}: credentials file of the remote store (default
 * {@code credentials.json}). The Drive store expects a JSON file with an {@code access_token}
 * field; service-account key files are not accepted.</li>
 * <li>{@code --run-today-only <true|false>}: only process files modified today (default
 * {@code true}).</li>
 * <li>{@code --tz <zone>}: time zone of "today" (default {@code America/New_York}).</li>
 * </ul>
 *
 * <p>
 * On success the summary line {@code processed: X, skipped: Y, failed: Z} is printed. Setup
 * failures are reported through {@link ErrorHandler} and turned into a non-zero exit status;
 * failures of individual files only show up in the audit log.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see SyncConfig
 * @see StoreConfig
 * @see PathsConfig
 * @see RemoteFileStoreFactory
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final SyncConfig syncConfig;
    private final PathsConfig pathsConfig;
    private final RemoteFileStoreFactory storeFactory;
    private final Clock clock;

    // Exit status reported to SpringApplication.exit
    private int exitCode = 0;

    /**
     * Bootstraps the application and exits with the status of the run.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        System.exit(SpringApplication.exit(context));
    }

    /**
     * Clock used for audit timestamps and the "today" filter.
     *
     * @return the system UTC clock
     */
    @Bean
    static Clock systemClock() {
        return Clock.systemUTC();
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String folderId = syncConfig.getRootFolderId();
        String credentials = syncConfig.getCredentials();
        boolean runTodayOnly = syncConfig.isRunTodayOnly();
        String tz = syncConfig.getTimezone();

        // Parse CLI arguments
        for (int i = 0; i < args.length; i++) {
            String name = StringUtils.substringBefore(args[i], "=");
            String value;
            if (args[i].contains("=")) {
                value = StringUtils.substringAfter(args[i], "=");
            } else {
                value = (i + 1 < args.length ? args[++i] : null);
            }
            switch (name) {
                case "--folder-id":
                    folderId = value;
                    break;
                case "--credentials":
                    credentials = value;
                    break;
                case "--run-today-only":
                    runTodayOnly = "true".equalsIgnoreCase(StringUtils.trim(value));
                    break;
                case "--tz":
                    tz = value;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (StringUtils.isBlank(folderId)) {
            exitCode = ErrorHandler.EXIT_GENERAL;
            ErrorHandler.errorAndExit(
                    "Root folder id is required. Use --folder-id or set 'sync.root-folder-id'.");
            return;
        }
        ZoneId zone = TimestampParser.zoneOrUtc(StringUtils.defaultIfBlank(tz, "America/New_York"));
        SyncOptions options = new SyncOptions(folderId.trim(), runTodayOnly, zone);
        log.info("Root folder: {}, Today only: {}, Time zone: {}", options.getRootFolderId(),
                runTodayOnly, zone);

        // Execute
        try {
            RemoteFileStore store = storeFactory.create(credentials);
            RunSummary summary =
                    new SyncOrchestrator(store, syncConfig, pathsConfig, clock).run(options);
            System.out.println("\nSummary → " + summary);
            System.out.println("Log saved: " + syncConfig.getCleanedFolderName() + "/"
                    + syncConfig.getLogName());
        } catch (RuntimeException e) {
            exitCode = ErrorHandler.exitCodeFor(e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
