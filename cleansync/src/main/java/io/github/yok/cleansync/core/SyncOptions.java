package io.github.yok.cleansync.core;

import java.time.ZoneId;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Parameters of one run, resolved from the command line and {@code sync.*} settings.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor
public class SyncOptions {

    // Container holding the raw CSV files
    private final String rootFolderId;

    private final boolean runTodayOnly;

    private final ZoneId zone;
}
