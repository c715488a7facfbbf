/**
 *  A processing step of the FORC pipeline: creates a new ForcData snapshot
 *  from the input snapshot and the configuration. Implementations must not
 *  modify the input data. Typically, stages are static method references
 *  such as ForcInterpolator::interpolate.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public interface ForcStage {
    /** Returns the processed data; the input must remain unchanged */
    ForcData apply(ForcData data, ForcConfig config);
}
