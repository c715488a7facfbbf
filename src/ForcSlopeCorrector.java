import ij.IJ;

/**
 *  Removes a background linear in the field (para- or diamagnetic contribution)
 *  from the magnetization grid.
 *
 *  The slope is fitted where the sample is saturated, |H| > hSat, only using
 *  measured grid points (H >= Hr, M not NaN). If there are points on both
 *  branches (H >= hSat and H < -hSat), each branch gets its own intercept,
 *  with a common slope. Only the slope term a*H is subtracted, not the intercepts.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcSlopeCorrector {

    /** Pipeline stage: Subtracts a*H from the magnetization grid, where the slope 'a'
     *  is the one given in the configuration or, if this is NaN, fitted.
     *  @throws IllegalArgumentException if there is no grid or no point to fit */
    public static ForcData correctSlope(ForcData data, ForcConfig config) {
        data.requireGrid();
        double slope = config.getSlope();
        if (Double.isNaN(slope))
            slope = fitSlope(data.getH(), data.getHr(), data.getM(), config.getHSat());
        else if (IJ.debugMode)
            IJ.log("Slope correction with fixed slope "+(float)slope);

        double[][] h = data.getH();
        double[][] m = data.getM();
        double[][] newM = new double[m.length][m[0].length];
        for (int i=0; i<m.length; i++)
            for (int j=0; j<m[i].length; j++)
                newM[i][j] = m[i][j] - slope*h[i][j];
        return data.withM(newM);
    }

    /** Returns the slope of the magnetization vs. field, fitted for |H| > hSat
     *  and H >= Hr, with separate intercepts for the two branches if both
     *  branches have data.
     *  @throws IllegalArgumentException if there are no data points to fit */
    static double fitSlope(double[][] h, double[][] hr, double[][] m, double hSat) {
        int nUpper = 0, nLower = 0;
        for (int i=0; i<h.length; i++)
            for (int j=0; j<h[i].length; j++)
                if (isFitPoint(h[i][j], hr[i][j], m[i][j], hSat)) {
                    if (h[i][j] >= hSat) nUpper++;
                    else nLower++;
                }
        if (nUpper + nLower == 0)
            throw new IllegalArgumentException("No data for slope fit with |H| > "+hSat);
        boolean twoBranches = nUpper > 0 && nLower > 0;

        ForcMultiVariateFitter fitter = new ForcMultiVariateFitter(twoBranches ? 3 : 2);
        double[] x = new double[twoBranches ? 3 : 2];
        for (int i=0; i<h.length; i++)
            for (int j=0; j<h[i].length; j++) {
                if (!isFitPoint(h[i][j], hr[i][j], m[i][j], hSat)) continue;
                x[0] = h[i][j];
                if (twoBranches) {
                    boolean upper = h[i][j] >= hSat;
                    x[1] = upper ? 1 : 0;
                    x[2] = upper ? 0 : 1;
                } else
                    x[1] = 1;
                fitter.addPoint(m[i][j], x);
            }
        double[] params = fitter.getFitParameters();
        if (IJ.debugMode)
            IJ.log("Slope fit of "+fitter.getNPoints()+" points: slope="+(float)params[0]+
                    (twoBranches ? ", intercepts "+(float)params[1]+", "+(float)params[2] : ", intercept "+(float)params[1]));
        if (Double.isNaN(params[0]))
            throw new IllegalArgumentException("Slope fit failed; all fit points at the same field?");
        return params[0];
    }

    /** Whether a grid point is in the fit region */
    private static boolean isFitPoint(double h, double hr, double m, double hSat) {
        return Math.abs(h) > hSat && !Double.isNaN(m) && h >= hr;
    }
}
