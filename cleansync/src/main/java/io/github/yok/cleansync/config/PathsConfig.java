package io.github.yok.cleansync.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code work-path} property from the application root
 * configuration and resolves the parent directory of the per-run temporary workspace.
 *
 * <p>
 * Downloaded sources, transformed outputs and the working copy of the audit log are written below
 * this directory for the duration of one run. When {@code work-path} is not set, the JVM temporary
 * directory ({@code java.io.tmpdir}) is used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Parent directory for per-run workspaces
    private String workPath;

    /**
     * Returns the directory under which run workspaces are created.
     *
     * @return absolute, normalized workspace parent directory
     */
    public Path getWorkDir() {
        String base = StringUtils.isBlank(workPath) ? System.getProperty("java.io.tmpdir")
                : workPath;
        return Paths.get(base).toAbsolutePath().normalize();
    }
}
