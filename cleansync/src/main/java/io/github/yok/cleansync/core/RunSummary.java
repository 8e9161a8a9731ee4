package io.github.yok.cleansync.core;

import java.util.Collection;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Counters reported at the end of a run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public class RunSummary {

    private final int processed;

    private final int skipped;

    private final int failed;

    /**
     * Counts the outcomes of a run. Date-filtered files are not counted.
     *
     * @param outcomes per-file outcomes
     * @return summary
     */
    public static RunSummary of(Collection<FileOutcome> outcomes) {
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        for (FileOutcome outcome : outcomes) {
            switch (outcome.getState()) {
                case SUCCEEDED:
                    processed++;
                    break;
                case UP_TO_DATE:
                    skipped++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    break;
            }
        }
        return new RunSummary(processed, skipped, failed);
    }

    @Override
    public String toString() {
        return String.format("processed: %d, skipped: %d, failed: %d", processed, skipped, failed);
    }
}
