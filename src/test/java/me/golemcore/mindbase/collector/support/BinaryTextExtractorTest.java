package me.golemcore.mindbase.collector.support;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BinaryTextExtractorTest {

    @Test
    void shouldKeepLongPrintableRunsOnly() {
        byte[] data = concat("short".getBytes(StandardCharsets.US_ASCII), new byte[] { 0, 1 },
                "a long printable run".getBytes(StandardCharsets.US_ASCII), new byte[] { (byte) 0xFF },
                "tiny".getBytes(StandardCharsets.US_ASCII));

        assertEquals("a long printable run", BinaryTextExtractor.extract(data));
    }

    @Test
    void shouldJoinRunsWithSpaces() {
        byte[] data = concat("{\"title\":\"first\"}".getBytes(StandardCharsets.US_ASCII), new byte[] { 0 },
                "{\"title\":\"second\"}".getBytes(StandardCharsets.US_ASCII));

        assertEquals("{\"title\":\"first\"} {\"title\":\"second\"}", BinaryTextExtractor.extract(data));
    }

    @Test
    void shouldReturnEmptyForEmptyInput() {
        assertEquals("", BinaryTextExtractor.extract(new byte[0]));
    }

    private static byte[] concat(byte[]... parts) {
        int length = List.of(parts).stream().mapToInt(part -> part.length).sum();
        byte[] result = new byte[length];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }
        return result;
    }
}
