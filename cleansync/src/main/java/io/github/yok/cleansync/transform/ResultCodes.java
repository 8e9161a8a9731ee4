package io.github.yok.cleansync.transform;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import lombok.Generated;

/**
 * Closed lookup table from delivery review outcome ({@code result} column) to its integer code.
 *
 * <p>
 * Values outside the table have no code; they are never coerced to zero.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ResultCodes {

    /**
     * Outcome label to code.
     */
    public static final Map<String, Integer> CODES = ImmutableMap.<String, Integer>builder()
            .put("Qualified", 0)
            .put("No Address Info", 1)
            .put("Location Not Clear", 2)
            .put("No Clear Shipping Label", 3)
            .put("Public or Unsafe Area", 4)
            .put("Invalid Mailbox Delivery", 5)
            .put("Leave Outside of Building", 6)
            .put("Wrong Address", 7)
            .put("Wrong Parcel Photo", 8)
            .put("No POD", 9)
            .put("Inappropriate Delivery", 10)
            .build();

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ResultCodes() {}

    /**
     * Looks up the code of an outcome label. Matching is exact (case and whitespace sensitive).
     *
     * @param label value of the {@code result} column, may be {@code null}
     * @return code, or empty when the label is not part of the table
     */
    public static Optional<Integer> codeOf(String label) {
        return label == null ? Optional.empty() : Optional.ofNullable(CODES.get(label));
    }
}
