import ij.IJ;
import ij.util.Tools;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 *  Reads FORC data files as written by Princeton Measurements Corporation
 *  (now Lake Shore) vibrating-sample magnetometers.
 *
 *  The file starts with a header of arbitrary lines; the data start with the
 *  first line beginning with '+' or '-'. Data lines have the form
 *  <pre>  +1.234567E+03,-5.678901E-03[,+2.950000E+02]</pre>
 *  with field, moment and (optionally) temperature. A curve is a block of
 *  subsequent data lines, terminated by any other line (usually empty) or the
 *  end of the file.
 *
 *  There are two conventions how the curves are framed, depending on whether
 *  the measurement was set up in H, Hr or Hc, Hb coordinates. In the latter
 *  case, the header contains lines starting with Hc1, Hc2, Hb1 or Hb2.
 *  - H, Hr: The curves follow each other; the last point of each curve is
 *    taken as its drift value.
 *  - Hc, Hb: Each curve is preceded by a single data line with the drift
 *    measurement, then one separator (non-data) line.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcIngester {
    /** Data line pattern: field, moment, and optional temperature */
    static final Pattern DATA_PATTERN = Pattern.compile(
            "([+-]\\d+\\.\\d+(?:E[+-]\\d+)?),"+
            "([+-]\\d+\\.\\d+(?:E[+-]\\d+)?)"+
            "(?:,([+-]\\d+\\.\\d+(?:E[+-]\\d+)?))?");
    /** Header lines selecting the Hc, Hb convention */
    static final Pattern HCHB_HEADER_PATTERN = Pattern.compile("(Hc1|Hc2|Hb1|Hb2).*");

    /** Reads the file given by the path and returns the raw data.
     *  @throws IllegalArgumentException if the path is null or empty
     *  @throws IOException if the file cannot be read
     *  @throws ForcFileFormatException if there is no data line in the file
     *  @throws ForcDataFormatException for Hc, Hb files where curves are not framed as expected */
    public static ForcData ingest(String filePath) throws IOException {
        if (filePath == null || filePath.length() == 0)
            throw new IllegalArgumentException("No file name specified");
        File file = new File(filePath);
        if (!file.isFile())
            throw new IOException("File not found: "+filePath);
        String str = IJ.openAsString(filePath);
        if (str == null || str.startsWith("Error:"))
            throw new IOException((str == null ? "Cannot read file" : str)+": "+filePath);
        return parse(str, file.getName());
    }

    /** Parses the text (contents of a FORC data file) and returns the raw data.
     *  The title is used for the ForcData and error messages; it may be null.
     *  @throws ForcFileFormatException if there is no data line in the text
     *  @throws ForcDataFormatException for Hc, Hb data where curves are not framed as expected */
    public static ForcData parse(String text, String title) throws ForcFileFormatException, ForcDataFormatException {
        String[] lines = text.split("\\r?\\n");
        for (int l=0; l<lines.length; l++)
            lines[l] = lines[l].trim();

        int dataStart = 0;          //find the first data line
        while (dataStart < lines.length && !(lines[dataStart].startsWith("+") || lines[dataStart].startsWith("-")))
            dataStart++;
        if (dataStart >= lines.length)
            throw new ForcFileFormatException("No FORC data found in "+(title == null ? "input" : title));

        boolean hcHb = isHcHb(lines, dataStart);
        CurveBuffer buffer = new CurveBuffer();
        if (hcHb)
            readHcHbCurves(lines, dataStart, buffer);
        else
            readHHrCurves(lines, dataStart, buffer);

        if (IJ.debugMode)
            IJ.log("FORC data '"+title+"': "+buffer.h.size()+" curves, "+
                    (hcHb ? "Hc, Hb" : "H, Hr")+" convention");
        return buffer.toForcData(title);
    }

    /** Returns whether the header (the lines before 'dataStart') indicates
     *  a measurement in Hc, Hb coordinates. */
    static boolean isHcHb(String[] lines, int dataStart) {
        for (int l=0; l<dataStart; l++)
            if (HCHB_HEADER_PATTERN.matcher(lines[l]).matches())
                return true;
        return false;
    }

    /** Reads curves in the H, Hr convention; the drift value is the last moment of each curve */
    private static void readHHrCurves(String[] lines, int start, CurveBuffer buffer) {
        int l = start;
        while (l < lines.length) {
            if (isDataLine(lines[l])) {
                l = readCurve(lines, l, buffer);
                double[] m = buffer.m.get(buffer.m.size()-1);
                buffer.drift.add(m[m.length-1]);
            }
            l++;
        }
    }

    /** Reads curves in the Hc, Hb convention: drift line, separator line, curve */
    private static void readHcHbCurves(String[] lines, int start, CurveBuffer buffer) throws ForcDataFormatException {
        int l = start;
        while (l < lines.length) {
            Matcher matcher = DATA_PATTERN.matcher(lines[l]);
            if (matcher.lookingAt()) {
                buffer.drift.add(Tools.parseDouble(matcher.group(2)));
                if (l + 2 >= lines.length)
                    throw new ForcDataFormatException("Drift point without subsequent curve", l+1);
                if (isDataLine(lines[l+1]))
                    throw new ForcDataFormatException("No separator line after drift point", l+2);
                if (!isDataLine(lines[l+2]))
                    throw new ForcDataFormatException("Unexpected data format at curve start", l+3);
                l = readCurve(lines, l+2, buffer);
            }
            l++;
        }
    }

    /** Reads one curve starting at line 'start', which must be a data line,
     *  and adds it to the buffer. Returns the index of the line after the curve. */
    private static int readCurve(String[] lines, int start, CurveBuffer buffer) {
        int end = start;
        while (end < lines.length && isDataLine(lines[end]))
            end++;
        int n = end - start;
        double[] h = new double[n], m = new double[n], t = new double[n];
        for (int i=0; i<n; i++) {
            Matcher matcher = DATA_PATTERN.matcher(lines[start+i]);
            matcher.lookingAt();
            h[i] = Tools.parseDouble(matcher.group(1));
            m[i] = Tools.parseDouble(matcher.group(2));
            String tStr = matcher.group(3);
            t[i] = tStr == null ? Double.NaN : Tools.parseDouble(tStr);
        }
        buffer.h.add(h);
        buffer.m.add(m);
        buffer.t.add(t);
        return end;
    }

    /** Returns whether the (trimmed) line starts with a valid data entry */
    static boolean isDataLine(String line) {
        return DATA_PATTERN.matcher(line).lookingAt();
    }

    /** Collects the curves while reading */
    private static class CurveBuffer {
        ArrayList<double[]> h = new ArrayList<double[]>();
        ArrayList<double[]> m = new ArrayList<double[]>();
        ArrayList<double[]> t = new ArrayList<double[]>();
        ArrayList<Double> drift = new ArrayList<Double>();

        ForcData toForcData(String title) {
            double[] mDrift = new double[drift.size()];
            for (int i=0; i<mDrift.length; i++)
                mDrift[i] = drift.get(i);
            return new ForcData(title, h.toArray(new double[0][]), m.toArray(new double[0][]),
                    t.toArray(new double[0][]), mDrift);
        }
    }
}
