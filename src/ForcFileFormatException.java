import java.io.IOException;

/**
 *  Thrown when a source does not contain any recognizable FORC data line,
 *  i.e., no line starting with a signed number.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcFileFormatException extends IOException {

    public ForcFileFormatException(String message) {
        super(message);
    }
}
