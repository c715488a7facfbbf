import java.io.IOException;

/**
 *  Thrown when the data lines of a FORC file violate the curve/drift-point framing
 *  of the measurement convention detected from the header.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcDataFormatException extends IOException {
    /** Line number (1-based) where the problem was detected */
    private final int lineNumber;

    public ForcDataFormatException(String message, int lineNumber) {
        super(message+" (line "+lineNumber+")");
        this.lineNumber = lineNumber;
    }

    /** Returns the (1-based) line number where the framing error was detected */
    public int getLineNumber() {
        return lineNumber;
    }
}
