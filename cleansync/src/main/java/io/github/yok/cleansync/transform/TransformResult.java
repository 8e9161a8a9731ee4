package io.github.yok.cleansync.transform;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Output of {@link CsvTransformer#transform}: the cleaned payload and the row counts observed
 * before and after normalization.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(exclude = "payload")
@AllArgsConstructor
public class TransformResult {

    private final TabularPayload payload;

    private final int rowsIn;

    private final int rowsOut;
}
