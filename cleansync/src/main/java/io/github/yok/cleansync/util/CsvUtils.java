package io.github.yok.cleansync.util;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Generated;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility class for reading and writing CSV files.
 *
 * <p>
 * Both the cleaned outputs and the audit log are written in UTF-8 using Apache Commons CSV with
 * minimal quoting and {@code \n} record separators. Reading returns the header as the first record.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    /**
     * Format used to parse CSV input. Blank lines are ignored. The header is returned as the first
     * record so that blank and repeated names can be passed through {@link #uniqueHeaders(List)}.
     */
    public static final CSVFormat READ_FORMAT =
            CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).get();

    /** Name prefix given to header cells that are blank. */
    public static final String UNNAMED_PREFIX = "Unnamed: ";

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private CsvUtils() {}

    /**
     * Makes raw header names usable as row keys.
     *
     * <p>
     * A blank name at position {@code i} becomes {@code "Unnamed: i"}. A repeated name gets a
     * {@code .N} suffix, counting from 1 and skipping suffixed names already present, so
     * {@code a,a,a} becomes {@code a,a.1,a.2}.
     * </p>
     *
     * @param raw header cells in file order
     * @return header names in the same order, all distinct
     */
    public static List<String> uniqueHeaders(List<String> raw) {
        List<String> names = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String name = raw.get(i);
            names.add(StringUtils.isBlank(name) ? UNNAMED_PREFIX + i : name);
        }
        Set<String> seen = new HashSet<>();
        Map<String, Integer> counts = new HashMap<>();
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            String unique = name;
            if (seen.contains(name)) {
                int n = counts.getOrDefault(name, 1);
                while (names.contains(name + "." + n) || seen.contains(name + "." + n)) {
                    n++;
                }
                unique = name + "." + n;
                counts.put(name, n + 1);
            }
            seen.add(unique);
            result.add(unique);
        }
        return result;
    }

    /**
     * Writes the given header and row data to a CSV file encoded in UTF-8.
     *
     * <p>
     * The CSV is written with:
     * </p>
     * <ul>
     * <li>Header row provided by {@code headers}</li>
     * <li>Quote mode: {@link QuoteMode#MINIMAL}</li>
     * <li>{@code null} cells rendered as empty fields</li>
     * <li>Record separator: {@code \n}</li>
     * </ul>
     *
     * @param csvFile the destination CSV file (will be created or overwritten)
     * @param headers the header columns to write as the first record
     * @param rows the data rows; each inner list represents one CSV record
     * @throws IOException if an I/O error occurs while writing the file
     */
    public static void writeCsvUtf8(Path csvFile, List<String> headers,
            List<? extends List<String>> rows) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(headers.toArray(new String[0]))
                .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator('\n').get();
        try (Writer w = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }
}
