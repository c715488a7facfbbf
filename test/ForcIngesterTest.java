import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ForcIngester}.
 */
class ForcIngesterTest {

    @Test
    @DisplayName("H/Hr file with curves of 3 and 4 points")
    void ingest_hHrFile() throws IOException {
        ForcData data = ForcIngester.ingest(ForcTestData.resourcePath("hhr_forc.txt"));

        assertEquals("hhr_forc.txt", data.getTitle());
        assertEquals(2, data.getHRaw().length);
        assertEquals(2, data.getMRaw().length);
        assertEquals(2, data.getTRaw().length);
        assertEquals(3, data.getHRaw()[0].length);
        assertEquals(4, data.getHRaw()[1].length);
        assertEquals(3, data.getMRaw()[0].length);
        assertEquals(4, data.getTRaw()[1].length);
        assertArrayEquals(new double[] {0, 1, 2, 3}, data.getHRaw()[1], 1e-12);
        assertArrayEquals(new double[] {3.0e-3, 3.1e-3}, data.getMDrift(), 1e-12);
        assertTrue(Double.isNaN(data.getTRaw()[0][0]));
        assertFalse(data.hasGrid());
    }

    @Test
    @DisplayName("Hc/Hb file: dedicated drift lines, temperature where present")
    void ingest_hcHbFile() throws IOException {
        ForcData data = ForcIngester.ingest(ForcTestData.resourcePath("hchb_forc.txt"));

        assertEquals(2, data.getNCurves());
        assertArrayEquals(new double[] {1, 2, 3}, data.getHRaw()[0], 1e-12);
        assertArrayEquals(new double[] {0, 1, 2, 3}, data.getHRaw()[1], 1e-12);
        assertArrayEquals(new double[] {3.05e-3, 3.02e-3}, data.getMDrift(), 1e-12);
        assertArrayEquals(new double[] {295, 295, 295}, data.getTRaw()[0], 1e-12);
        for (double t : data.getTRaw()[1])
            assertTrue(Double.isNaN(t));
    }

    @Test
    @DisplayName("Number of curves equals the number of data blocks")
    void parse_curveCountEqualsBlocks() throws IOException {
        String text = "Header\n\n"+
                "+1.0,+1.0\n+2.0,+2.0\n\n"+
                "+0.5,+0.5\n+1.0,+1.0\nsomething else\n"+
                "+0.0,+0.1\n+1.0,+1.1\n+2.0,+2.1";        //no newline at the end

        ForcData data = ForcIngester.parse(text, "blocks");

        assertEquals(3, data.getNCurves());
        assertEquals(3, data.getMDrift().length);
        assertEquals(2.1, data.getMDrift()[2], 1e-12);
    }

    @Test
    @DisplayName("Exponents, negative values and CRLF line ends")
    void parse_formatVariants() throws IOException {
        String text = "Header\r\n-1.500000E+02,-2.500000E-05\r\n+1.5,+0.25E-01\r\n";

        ForcData data = ForcIngester.parse(text, null);

        assertEquals(1, data.getNCurves());
        assertArrayEquals(new double[] {-150, 1.5}, data.getHRaw()[0], 1e-12);
        assertEquals(-2.5e-5, data.getMRaw()[0][0], 1e-17);
    }

    @Test
    @DisplayName("No data line throws ForcFileFormatException")
    void parse_noDataLine() {
        assertThrows(ForcFileFormatException.class,
                () -> ForcIngester.parse("Header only\nno data\n", "empty"));
    }

    @Test
    @DisplayName("Hc/Hb: drift line followed by a data line is a format error")
    void parse_missingSeparator() {
        String text = "Hc1 = 1\n+3.0,+1.0\n+1.0,+1.0\n+2.0,+1.0\n";

        ForcDataFormatException e = assertThrows(ForcDataFormatException.class,
                () -> ForcIngester.parse(text, "noSeparator"));
        assertEquals(3, e.getLineNumber());
    }

    @Test
    @DisplayName("Hc/Hb: no data after the separator is a format error")
    void parse_malformedCurveStart() {
        String text = "Hb2 = 1\n+3.0,+1.0\n\nnot data\n+1.0,+1.0\n";

        ForcDataFormatException e = assertThrows(ForcDataFormatException.class,
                () -> ForcIngester.parse(text, "malformed"));
        assertEquals(4, e.getLineNumber());
    }

    @Test
    @DisplayName("Hc/Hb: drift line at the end is a format error")
    void parse_driftLineAtEnd() {
        String text = "Hc2 = 1\n+3.0,+1.0\n\n+1.0,+1.0\n\n+3.0,+1.0\n";

        assertThrows(ForcDataFormatException.class, () -> ForcIngester.parse(text, "truncated"));
    }

    @Test
    @DisplayName("Framing convention from the header")
    void isHcHb_detection() {
        String[] hcHb = new String[] {"Field range", "Hb1 = -5.0E-01", "+1.0,+1.0"};
        String[] hHr = new String[] {"Field range", "NHc1 = 3", "+1.0,+1.0"};

        assertTrue(ForcIngester.isHcHb(hcHb, 2));
        assertFalse(ForcIngester.isHcHb(hHr, 2));
    }

    @Test
    @DisplayName("Missing file name and missing file")
    void ingest_invalidPath() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ForcIngester.ingest(""));
        assertEquals("No file name specified", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ForcIngester.ingest(null));
        assertThrows(IOException.class, () -> ForcIngester.ingest("/nonexistent/dir/forc.txt"));
    }
}
