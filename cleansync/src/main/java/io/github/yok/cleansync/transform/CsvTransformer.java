package io.github.yok.cleansync.transform;

import com.google.common.collect.ImmutableList;
import io.github.yok.cleansync.exception.DecodeException;
import io.github.yok.cleansync.exception.TransformException;
import io.github.yok.cleansync.util.CsvUtils;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads a raw CSV file and applies the fixed set of column normalizations.
 *
 * <p>
 * <strong>Encoding resolution:</strong> the candidates in {@link #DEFAULT_CANDIDATES} are tried in
 * order and the first one that both decodes the bytes and parses them as CSV wins. When all of
 * them fail, a single {@link DecodeException} is raised with each attempt attached as a suppressed
 * exception.
 * </p>
 *
 * <p>
 * <strong>Normalization</strong> (each rule only applies when its column is present):
 * </p>
 * <ul>
 * <li>{@code partner_id}, {@code team_id}: trailing {@code .0} removed</li>
 * <li>{@code zipcode}: cut at the first {@code -} (ZIP+4 suffix dropped)</li>
 * <li>{@code VALID POD}: new column {@code VALID POD_encoded}, {@code Y → 0}, {@code N → 1},
 * otherwise empty</li>
 * <li>{@code result}: new column {@code result_encoded} from {@link ResultCodes}, otherwise
 * {@value #NULL_MARKER}</li>
 * </ul>
 *
 * <p>
 * The number of rows never changes; a mismatch raises {@link TransformException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvTransformer {

    /**
     * Text written to {@code result_encoded} when the outcome label has no code.
     */
    public static final String NULL_MARKER = "<NA>";

    public static final String PARTNER_ID = "partner_id";
    public static final String TEAM_ID = "team_id";
    public static final String ZIPCODE = "zipcode";
    public static final String VALID_POD = "VALID POD";
    public static final String VALID_POD_ENCODED = "VALID POD_encoded";
    public static final String RESULT = "result";
    public static final String RESULT_ENCODED = "result_encoded";

    /**
     * Encodings tried in order: platform default, UTF-8, UTF-8 with signature, Latin-1.
     */
    public static final List<EncodingCandidate> DEFAULT_CANDIDATES =
            ImmutableList.of(new EncodingCandidate("platform default", Charset.defaultCharset(),
                    false), new EncodingCandidate("UTF-8", StandardCharsets.UTF_8, false),
                    new EncodingCandidate("UTF-8-SIG", StandardCharsets.UTF_8, true),
                    new EncodingCandidate("ISO-8859-1", StandardCharsets.ISO_8859_1, false));

    private final List<EncodingCandidate> candidates;

    /**
     * Creates a transformer using {@link #DEFAULT_CANDIDATES}.
     */
    public CsvTransformer() {
        this(DEFAULT_CANDIDATES);
    }

    /**
     * Creates a transformer with a custom encoding order.
     *
     * @param candidates encodings tried in order
     */
    CsvTransformer(List<EncodingCandidate> candidates) {
        this.candidates = ImmutableList.copyOf(candidates);
    }

    /**
     * Reads and normalizes a raw CSV file.
     *
     * @param rawFile local copy of the source file
     * @return cleaned payload with row counts
     * @throws DecodeException if no candidate encoding parses the file
     * @throws TransformException if normalization fails or changes the number of rows
     */
    public TransformResult transform(Path rawFile) {
        byte[] content;
        try {
            content = Files.readAllBytes(rawFile);
        } catch (IOException e) {
            throw new DecodeException("Cannot read " + rawFile.getFileName(), e);
        }
        TabularPayload raw = decode(content, rawFile.getFileName().toString());
        TabularPayload cleaned;
        try {
            cleaned = normalize(raw);
        } catch (RuntimeException e) {
            throw new TransformException("Normalization failed: " + e.getMessage(), e);
        }
        if (cleaned.rowCount() != raw.rowCount()) {
            throw new TransformException(String.format(
                    "Row count changed during transform: %d -> %d", raw.rowCount(),
                    cleaned.rowCount()));
        }
        return new TransformResult(cleaned, raw.rowCount(), cleaned.rowCount());
    }

    /**
     * Writes a payload as UTF-8 CSV.
     *
     * @param payload payload to write
     * @param target destination file (created or overwritten)
     * @throws TransformException if the file cannot be written
     */
    public void write(TabularPayload payload, Path target) {
        try {
            CsvUtils.writeCsvUtf8(target, payload.getHeaders(), payload.toRecords());
        } catch (IOException e) {
            throw new TransformException("Cannot write " + target.getFileName(), e);
        }
    }

    /**
     * Parses raw bytes with the first candidate encoding that succeeds.
     *
     * @param content raw bytes
     * @param label name used in messages
     * @return parsed payload
     * @throws DecodeException if every candidate fails
     */
    TabularPayload decode(byte[] content, String label) {
        List<Exception> failures = new ArrayList<>();
        for (EncodingCandidate candidate : candidates) {
            try {
                TabularPayload payload = parse(candidate.decode(content));
                log.debug("Read {} as {} ({} rows)", label, candidate.getLabel(),
                        payload.rowCount());
                return payload;
            } catch (IOException | UncheckedIOException | IllegalArgumentException
                    | IllegalStateException e) {
                log.debug("Reading {} as {} failed: {}", label, candidate.getLabel(),
                        e.getMessage());
                failures.add(e);
            }
        }
        String tried = candidates.stream().map(EncodingCandidate::getLabel)
                .collect(Collectors.joining(", "));
        DecodeException ex = new DecodeException(
                "Cannot read CSV (incompatible encoding): " + label + ", tried [" + tried + "]");
        failures.forEach(ex::addSuppressed);
        throw ex;
    }

    /**
     * Parses decoded CSV text.
     *
     * @param text decoded text
     * @return parsed payload
     * @throws IOException on malformed CSV
     * @throws IllegalStateException if there is no header or a record has more fields than the
     *         header
     */
    TabularPayload parse(String text) throws IOException {
        try (CSVParser parser = CSVParser.parse(new StringReader(text), CsvUtils.READ_FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new IllegalStateException("No columns to parse from file");
            }
            List<String> headers = CsvUtils.uniqueHeaders(records.next().toList());
            List<Map<String, String>> rows = new ArrayList<>();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() > headers.size()) {
                    throw new IllegalStateException(String.format(
                            "Expected %d fields in line %d, saw %d", headers.size(),
                            record.getRecordNumber(), record.size()));
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    row.put(headers.get(i), i < record.size() ? record.get(i) : null);
                }
                rows.add(row);
            }
            return new TabularPayload(headers, rows);
        }
    }

    /**
     * Applies the column rules to every row.
     *
     * @param raw parsed payload
     * @return normalized payload with the same number of rows
     */
    TabularPayload normalize(TabularPayload raw) {
        List<String> headers = new ArrayList<>(raw.getHeaders());
        if (raw.hasColumn(VALID_POD) && !headers.contains(VALID_POD_ENCODED)) {
            headers.add(VALID_POD_ENCODED);
        }
        if (raw.hasColumn(RESULT) && !headers.contains(RESULT_ENCODED)) {
            headers.add(RESULT_ENCODED);
        }

        List<Map<String, String>> rows = new ArrayList<>(raw.rowCount());
        for (Map<String, String> source : raw.getRows()) {
            Map<String, String> row = new LinkedHashMap<>(source);
            apply(row, PARTNER_ID, CsvTransformer::stripFloatSuffix);
            apply(row, TEAM_ID, CsvTransformer::stripFloatSuffix);
            apply(row, ZIPCODE, CsvTransformer::stripZipSuffix);
            if (raw.hasColumn(VALID_POD)) {
                row.put(VALID_POD_ENCODED, encodeValidPod(source.get(VALID_POD)));
            }
            if (raw.hasColumn(RESULT)) {
                row.put(RESULT_ENCODED, ResultCodes.codeOf(source.get(RESULT))
                        .map(String::valueOf).orElse(NULL_MARKER));
            }
            rows.add(row);
        }
        return new TabularPayload(headers, rows);
    }

    private static void apply(Map<String, String> row, String column,
            UnaryOperator<String> rule) {
        if (row.containsKey(column) && row.get(column) != null) {
            row.put(column, rule.apply(row.get(column)));
        }
    }

    /**
     * Removes a trailing {@code .0} left by a numeric-to-text round trip ({@code 1234.0 → 1234}).
     *
     * @param value cell value
     * @return value without the suffix
     */
    static String stripFloatSuffix(String value) {
        return StringUtils.removeEnd(value, ".0");
    }

    /**
     * Drops the ZIP+4 extension ({@code 10001-1234 → 10001}).
     *
     * @param value cell value
     * @return value up to the first {@code -}
     */
    static String stripZipSuffix(String value) {
        return StringUtils.substringBefore(value, "-");
    }

    static String encodeValidPod(String value) {
        if ("Y".equals(value)) {
            return "0";
        }
        if ("N".equals(value)) {
            return "1";
        }
        return null;
    }
}
