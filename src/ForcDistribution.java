import ij.IJ;
import java.util.Arrays;
import java.util.HashMap;

/**
 *  Computes the FORC distribution rho = -1/2 d^2M/(dH dHr) from the
 *  magnetization grid.
 *
 *  The mixed derivative is obtained by convolution with a kernel that is
 *  equivalent to a least-squares fit of a quadratic surface
 *    z = c0 + c1*x + c2*x^2 + c3*y + c4*y^2 + c5*x*y
 *  to the (2*sf+1)^2 neighborhood of each point; the kernel contains the
 *  weights of the data points for the coefficient c5 (Savitzky-Golay filter,
 *  see Heslop and Muxworthy, J. Magn. Magn. Mater. 288, 155 (2005)).
 *  Points closer than sf to the border of the grid and points with a NaN
 *  value in their neighborhood have a NaN FORC distribution.
 *
 *  Close to the H = Hr diagonal, the neighborhood is incomplete. Thus, the
 *  magnetization grid can be extended towards lower H before computing the
 *  FORC distribution; see 'extend'.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcDistribution {
    /** Types of extension towards low H before computing the FORC distribution */
    public static final int EXTENSION_NONE = 0, EXTENSION_FLAT = 1, EXTENSION_LINEAR = 2;
    /** Names of the extension types, as used in the keyword lookup */
    public static final String[] EXTENSION_NAMES = new String[] {"none", "flat", "linear"};
    /** Index of the xy coefficient in the quadratic surface */
    private static final int XY_INDEX = 5;
    /** Kernels for unit steps already calculated, the key is sf */
    private static final HashMap<Integer, double[][]> kernelCache = new HashMap<Integer, double[][]>();

    /** Returns the extension type for a given name (case-insensitive)
     *  @throws UnsupportedOperationException if there is no such type */
    public static int getExtensionType(String name) {
        for (int i=0; i<EXTENSION_NAMES.length; i++)
            if (EXTENSION_NAMES[i].equalsIgnoreCase(name))
                return i;
        throw new UnsupportedOperationException("Extension type not implemented: "+name);
    }

    /** Pipeline stage: Returns the data with the FORC distribution computed from
     *  the magnetization grid with the smoothing factor of the configuration.
     *  @throws IllegalArgumentException if there is no grid */
    public static ForcData computeDistribution(ForcData data, ForcConfig config) {
        data.requireGrid();
        int sf = config.getSmoothingFactor();
        double[][] h = data.getH();
        double[][] hr = data.getHr();
        double[][] m = data.getM();
        int nRows = m.length, nCols = m[0].length;
        double[][] rho = ForcUtils.nanGrid(nRows, nCols);
        if (nRows > 2*sf && nCols > 2*sf) {
            double[][] kernel = getKernel(sf, data.getGridStepH(), data.getGridStepHr());
            for (int i=sf; i<nRows-sf; i++)
                for (int j=sf; j<nCols-sf; j++) {
                    if (h[i][j] < hr[i][j]) continue;
                    double sum = 0;
                    for (int dy=-sf; dy<=sf; dy++) {
                        double[] mRow = m[i+dy];
                        double[] kRow = kernel[dy+sf];
                        for (int dx=-sf; dx<=sf; dx++)
                            sum += kRow[dx+sf]*mRow[j+dx];
                    }
                    rho[i][j] = -0.5*sum;       //NaN if any NaN in the neighborhood
                }
        }
        if (IJ.debugMode)
            IJ.log("FORC distribution with sf="+sf+": "+ForcUtils.countNonNaN(rho)+" valid points");
        return data.withRho(rho);
    }

    /** Returns the kernel for the mixed derivative d^2M/(dH dHr), for a grid with
     *  spacing stepH along H (columns) and stepHr along Hr (rows). The kernel is
     *  a double[2*sf+1][2*sf+1] array, with kernel[sf+dy][sf+dx] the weight of
     *  the point dx columns and dy rows away from the center.
     *  @throws IllegalArgumentException for sf < 1 */
    public static double[][] getKernel(int sf, double stepH, double stepHr) {
        double[][] unitKernel = getUnitKernel(sf);
        double norm = 1.0/(stepH*stepHr);
        double[][] kernel = new double[unitKernel.length][unitKernel.length];
        for (int i=0; i<kernel.length; i++)
            for (int j=0; j<kernel.length; j++)
                kernel[i][j] = unitKernel[i][j]*norm;
        return kernel;
    }

    /** Returns the kernel for a grid spacing of 1 in both directions.
     *  Kernels are cached; the array returned must not be modified.
     *  @throws IllegalArgumentException for sf < 1 */
    static double[][] getUnitKernel(int sf) {
        if (sf < 1)
            throw new IllegalArgumentException("Smoothing factor must be 1 or more: "+sf);
        synchronized(kernelCache) {
            double[][] kernel = kernelCache.get(sf);
            if (kernel == null) {
                kernel = makeKernel(sf);
                kernelCache.put(sf, kernel);
            }
            return kernel;
        }
    }

    /** Calculates the kernel. Internally, the coordinates are scaled to the
     *  range -1 ... +1 for numerical stability. */
    static double[][] makeKernel(int sf) {
        int size = 2*sf + 1;
        ForcMultiVariateFitter fitter = new ForcMultiVariateFitter(6);
        for (int dy=-sf; dy<=sf; dy++)
            for (int dx=-sf; dx<=sf; dx++)
                fitter.addPoint(0, getBasis(dx/(double)sf, dy/(double)sf));
        double norm = 1.0/(sf*(double)sf);
        double[][] kernel = new double[size][size];
        for (int dy=-sf; dy<=sf; dy++)
            for (int dx=-sf; dx<=sf; dx++) {
                double[] weights = fitter.getParameterWeights(getBasis(dx/(double)sf, dy/(double)sf));
                kernel[dy+sf][dx+sf] = weights[XY_INDEX]*norm;
            }
        return kernel;
    }

    /** Basis functions of the quadratic surface: 1, x, x^2, y, y^2, xy */
    private static double[] getBasis(double x, double y) {
        return new double[] {1, x, x*x, y, y*y, x*y};
    }

    /** Pipeline stage: Extends the grid by 'sf' (smoothing factor) columns towards
     *  lower H, and fills up to 'sf' cells left of the first valid M value of each
     *  row, according to the extension type of the configuration: With
     *  EXTENSION_FLAT, the first valid value is replicated, with EXTENSION_LINEAR,
     *  a straight line fitted to the first few valid points of the row is extrapolated.
     *  T is NaN in the new columns. The filled cells are an exception to the rule
     *  that M is NaN for H < Hr; they serve only as neighborhood for computing the
     *  FORC distribution. With EXTENSION_NONE, the input data are returned.
     *  Any FORC distribution of the input is not retained.
     *  @throws IllegalArgumentException if there is no grid */
    public static ForcData extend(ForcData data, ForcConfig config) {
        int extension = config.getExtension();
        if (extension == EXTENSION_NONE)
            return data;
        data.requireGrid();
        int sf = config.getSmoothingFactor();
        double[][] h = data.getH();
        double[][] hr = data.getHr();
        double[][] m = data.getM();
        double[][] t = data.getT();
        int nRows = h.length, nCols = h[0].length;
        double stepH = data.getGridStepH();
        if (Double.isNaN(stepH))
            stepH = data.getGridStepHr();
        if (!(stepH > 0))
            throw new IllegalArgumentException("Cannot extend a grid with a single point");

        int newCols = nCols + sf;
        double[][] newH = new double[nRows][newCols];
        double[][] newHr = new double[nRows][newCols];
        double[][] newM = ForcUtils.nanGrid(nRows, newCols);
        double[][] newT = ForcUtils.nanGrid(nRows, newCols);
        for (int i=0; i<nRows; i++) {
            for (int j=0; j<sf; j++)
                newH[i][j] = h[i][0] - (sf - j)*stepH;
            System.arraycopy(h[i], 0, newH[i], sf, nCols);
            Arrays.fill(newHr[i], hr[i][0]);
            System.arraycopy(m[i], 0, newM[i], sf, nCols);
            System.arraycopy(t[i], 0, newT[i], sf, nCols);
            extendRow(newH[i], newM[i], sf, extension, config.getExtensionFitPoints());
        }
        if (IJ.debugMode)
            IJ.log("Extension ("+EXTENSION_NAMES[extension]+") by "+sf+" columns");
        return data.withGrid(newH, newHr, newM, newT);
    }

    /** Fills up to 'n' NaN values of m left of the first valid value */
    static void extendRow(double[] h, double[] m, int n, int extension, int nFitPoints) {
        int first = ForcUtils.firstNonNaN(m);
        if (first <= 0) return;
        int start = Math.max(first - n, 0);
        if (extension == EXTENSION_FLAT) {
            for (int j=start; j<first; j++)
                m[j] = m[first];
        } else if (extension == EXTENSION_LINEAR) {
            ForcLinearRegression regression = new ForcLinearRegression();
            for (int j=first; j<m.length && regression.getCounter()<nFitPoints; j++)
                regression.addPoint(h[j], m[j]);     //NaN values are ignored
            for (int j=start; j<first; j++)
                m[j] = regression.getFitValue(h[j]);
        }
    }
}
