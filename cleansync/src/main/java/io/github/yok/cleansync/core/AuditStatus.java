package io.github.yok.cleansync.core;

import java.util.Arrays;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one processing attempt as written to the audit log.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum AuditStatus {

    // Source was transformed and uploaded.
    OK("ok"),

    // Some step failed; see the message column.
    FAIL("fail");

    // Value written to the status column
    private final String value;

    /**
     * Resolves a status column value (case-insensitive).
     *
     * @param value column value
     * @return matching status, or empty
     */
    public static Optional<AuditStatus> fromValue(String value) {
        return Arrays.stream(values()).filter(s -> s.value.equalsIgnoreCase(value)).findFirst();
    }
}
