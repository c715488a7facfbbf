/**
 *  Scales the magnetization grid to the range from -1 to +1.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcNormalizer {

    /** Pipeline stage: Returns the data with M' = 1 - 2*(max - M)/(max - min),
     *  where max and min are the extrema of the non-NaN values. NaN values are kept.
     *  @throws IllegalArgumentException if there is no grid or only NaN values of M */
    public static ForcData normalize(ForcData data, ForcConfig config) {
        data.requireGrid();
        double[][] m = data.getM();
        double[] minMax = ForcUtils.getMinMax(m);
        if (Double.isNaN(minMax[0]))
            throw new IllegalArgumentException("Cannot normalize; no valid magnetization data");
        double max = minMax[1];
        double factor = 2.0/(minMax[1] - minMax[0]);
        double[][] newM = new double[m.length][m[0].length];
        for (int i=0; i<m.length; i++)
            for (int j=0; j<m[i].length; j++)
                newM[i][j] = 1 - (max - m[i][j])*factor;
        return data.withM(newM);
    }
}
