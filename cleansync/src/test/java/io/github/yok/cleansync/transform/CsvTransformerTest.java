package io.github.yok.cleansync.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.cleansync.exception.DecodeException;
import io.github.yok.cleansync.exception.TransformException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvTransformerTest {

    // Fixed order without the platform default, so results do not depend on the build machine
    private static final List<EncodingCandidate> PORTABLE_CANDIDATES =
            CsvTransformer.DEFAULT_CANDIDATES.subList(1, 4);

    @TempDir
    Path tempDir;

    private final CsvTransformer transformer = new CsvTransformer(PORTABLE_CANDIDATES);

    private Path write(String name, byte[] content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return file;
    }

    private Path write(String name, String content) throws Exception {
        return write(name, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void transform_正常ケース_全対象列を含むCSVを指定する_各列が正規化されること() throws Exception {
        Path raw = write("report.csv",
                "partner_id,team_id,zipcode,VALID POD,result\n"
                        + "1234.0,56.0,10001-1234,Y,Wrong Address\n"
                        + "77,8.0,90210,N,Something Else\n"
                        + "88,,,,Qualified\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(3, result.getRowsIn());
        assertEquals(3, result.getRowsOut());
        TabularPayload payload = result.getPayload();
        assertEquals(Arrays.asList("partner_id", "team_id", "zipcode", "VALID POD", "result",
                "VALID POD_encoded", "result_encoded"), payload.getHeaders());

        Map<String, String> first = payload.getRows().get(0);
        assertEquals("1234", first.get("partner_id"));
        assertEquals("56", first.get("team_id"));
        assertEquals("10001", first.get("zipcode"));
        assertEquals("0", first.get("VALID POD_encoded"));
        assertEquals("7", first.get("result_encoded"));

        Map<String, String> second = payload.getRows().get(1);
        assertEquals("77", second.get("partner_id"));
        assertEquals("8", second.get("team_id"));
        assertEquals("1", second.get("VALID POD_encoded"));
        assertEquals(CsvTransformer.NULL_MARKER, second.get("result_encoded"));

        Map<String, String> third = payload.getRows().get(2);
        assertEquals("", third.get("team_id"));
        assertEquals("", third.get("zipcode"));
        assertNull(third.get("VALID POD_encoded"));
        assertEquals("0", third.get("result_encoded"));
    }

    @Test
    void transform_正常ケース_対象列を含まないCSVを指定する_内容が変わらないこと() throws Exception {
        Path raw = write("plain.csv", "name,amount\nalpha,1.0\nbeta,2-3\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(Arrays.asList("name", "amount"), result.getPayload().getHeaders());
        assertEquals("1.0", result.getPayload().getRows().get(0).get("amount"));
        assertEquals("2-3", result.getPayload().getRows().get(1).get("amount"));
    }

    @Test
    void transform_正常ケース_ヘッダのみのCSVを指定する_0行で成功すること() throws Exception {
        Path raw = write("header.csv", "partner_id,result\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(0, result.getRowsIn());
        assertEquals(0, result.getRowsOut());
        assertEquals(Arrays.asList("partner_id", "result", "result_encoded"),
                result.getPayload().getHeaders());
    }

    @Test
    void transform_正常ケース_Latin1のCSVを指定する_Latin1で読み込まれること() throws Exception {
        Path raw = write("latin.csv", "name,result\nCafé,No POD\n"
                .getBytes(StandardCharsets.ISO_8859_1));

        TransformResult result = transformer.transform(raw);

        assertEquals("Café", result.getPayload().getRows().get(0).get("name"));
        assertEquals("9", result.getPayload().getRows().get(0).get("result_encoded"));
    }

    @Test
    void transform_正常ケース_BOM付きUTF8のCSVを指定する_BOMが除去されること() throws Exception {
        Path raw = write("bom.csv", "\uFEFFpartner_id,name\n1.0,東京\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(Arrays.asList("partner_id", "name"), result.getPayload().getHeaders());
        assertEquals("1", result.getPayload().getRows().get(0).get("partner_id"));
        assertEquals("東京", result.getPayload().getRows().get(0).get("name"));
    }

    @Test
    void transform_正常ケース_短いレコードを指定する_不足セルが空として扱われること()
            throws Exception {
        Path raw = write("short.csv", "partner_id,team_id\n5.0\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(1, result.getRowsOut());
        assertEquals("5", result.getPayload().getRows().get(0).get("partner_id"));
        assertNull(result.getPayload().getRows().get(0).get("team_id"));
    }

    @Test
    void transform_異常ケース_空ファイルを指定する_DecodeExceptionが送出されること()
            throws Exception {
        Path raw = write("empty.csv", new byte[0]);

        DecodeException ex = assertThrows(DecodeException.class, () -> transformer.transform(raw));

        assertTrue(ex.getMessage().startsWith("Cannot read CSV (incompatible encoding)"));
        assertEquals(PORTABLE_CANDIDATES.size(), ex.getSuppressed().length);
    }

    @Test
    void transform_異常ケース_既定の候補で空ファイルを指定する_DecodeExceptionが送出されること()
            throws Exception {
        Path raw = write("empty.csv", new byte[0]);

        DecodeException ex =
                assertThrows(DecodeException.class, () -> new CsvTransformer().transform(raw));

        assertTrue(ex.getMessage().contains("platform default"));
        assertEquals(CsvTransformer.DEFAULT_CANDIDATES.size(), ex.getSuppressed().length);
    }

    @Test
    void transform_異常ケース_どの候補でも復号できないバイト列を指定する_DecodeExceptionが送出されること()
            throws Exception {
        CsvTransformer utf8Only =
                new CsvTransformer(List.of(CsvTransformer.DEFAULT_CANDIDATES.get(1)));
        Path raw = write("broken.csv", new byte[] {'a', '\n', (byte) 0xC3, (byte) 0x28, '\n'});

        DecodeException ex = assertThrows(DecodeException.class, () -> utf8Only.transform(raw));

        assertTrue(ex.getMessage().contains("broken.csv"));
        assertEquals(1, ex.getSuppressed().length);
    }

    @Test
    void transform_異常ケース_ヘッダより多い列を持つレコードを指定する_DecodeExceptionが送出されること()
            throws Exception {
        Path raw = write("wide.csv", "a,b\n1,2,3\n");
        assertThrows(DecodeException.class, () -> transformer.transform(raw));
    }

    @Test
    void transform_正常ケース_重複ヘッダを指定する_連番付きの列名で読み込まれること() throws Exception {
        Path raw = write("dup.csv", "a,a,partner_id\n1,2,3.0\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(Arrays.asList("a", "a.1", "partner_id"), result.getPayload().getHeaders());
        Map<String, String> row = result.getPayload().getRows().get(0);
        assertEquals("1", row.get("a"));
        assertEquals("2", row.get("a.1"));
        assertEquals("3", row.get("partner_id"));
    }

    @Test
    void transform_正常ケース_先頭に名前のないインデックス列を持つCSVを指定する_Unnamed列として読み込まれること()
            throws Exception {
        Path raw = write("indexed.csv",
                ",partner_id,result\n0,12.0,Wrong Address\n1,13.0,Qualified\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(2, result.getRowsOut());
        assertEquals(Arrays.asList("Unnamed: 0", "partner_id", "result", "result_encoded"),
                result.getPayload().getHeaders());
        Map<String, String> first = result.getPayload().getRows().get(0);
        assertEquals("0", first.get("Unnamed: 0"));
        assertEquals("12", first.get("partner_id"));
        assertEquals("7", first.get("result_encoded"));
        assertEquals("0", result.getPayload().getRows().get(1).get("result_encoded"));
    }

    @Test
    void transform_正常ケース_末尾カンマ付きのヘッダを持つCSVを指定する_末尾が空のUnnamed列になること()
            throws Exception {
        Path raw = write("trailing.csv", "partner_id,result,\n12.0,Wrong Address,\n");

        TransformResult result = transformer.transform(raw);

        assertEquals(Arrays.asList("partner_id", "result", "Unnamed: 2", "result_encoded"),
                result.getPayload().getHeaders());
        Map<String, String> row = result.getPayload().getRows().get(0);
        assertEquals("12", row.get("partner_id"));
        assertEquals("", row.get("Unnamed: 2"));
        assertEquals("7", row.get("result_encoded"));
    }

    @Test
    void transform_異常ケース_存在しないファイルを指定する_DecodeExceptionが送出されること() {
        assertThrows(DecodeException.class,
                () -> transformer.transform(tempDir.resolve("missing.csv")));
    }

    @Test
    void write_正常ケース_変換結果を書き出す_UTF8のCSVとして出力されること() throws Exception {
        Path raw = write("in.csv", "partner_id,zipcode,result\n9.0,02134-0001,Qualified\n"
                + "10.0,02135,Unknown\n");
        Path out = tempDir.resolve("out.csv");

        transformer.write(transformer.transform(raw).getPayload(), out);

        assertEquals("partner_id,zipcode,result,result_encoded\n" + "9,02134,Qualified,0\n"
                + "10,02135,Unknown,<NA>\n", Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void write_異常ケース_書き込めない出力先を指定する_TransformExceptionが送出されること()
            throws Exception {
        TabularPayload payload = new TabularPayload(List.of("a"), List.of(Map.of("a", "1")));
        Path target = tempDir.resolve("no-such-dir").resolve("out.csv");

        assertThrows(TransformException.class, () -> transformer.write(payload, target));
    }

    @Test
    void stripFloatSuffix_正常ケース_末尾のみ除去されること() {
        assertEquals("1234", CsvTransformer.stripFloatSuffix("1234.0"));
        assertEquals("1.05", CsvTransformer.stripFloatSuffix("1.05"));
        assertEquals("10.0", CsvTransformer.stripFloatSuffix("10.0.0"));
        assertEquals("abc", CsvTransformer.stripFloatSuffix("abc"));
    }

    @Test
    void stripZipSuffix_正常ケース_最初のハイフン以降が除去されること() {
        assertEquals("10001", CsvTransformer.stripZipSuffix("10001-1234"));
        assertEquals("10001", CsvTransformer.stripZipSuffix("10001"));
        assertEquals("", CsvTransformer.stripZipSuffix("-1234"));
    }

    @Test
    void encodeValidPod_正常ケース_YとN以外を指定する_nullが返ること() {
        assertEquals("0", CsvTransformer.encodeValidPod("Y"));
        assertEquals("1", CsvTransformer.encodeValidPod("N"));
        assertNull(CsvTransformer.encodeValidPod("y"));
        assertNull(CsvTransformer.encodeValidPod(""));
        assertNull(CsvTransformer.encodeValidPod(null));
    }
}
