import ij.IJ;
import ij.measure.SplineFitter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;

/**
 *  Interpolates the raw (ragged) FORC curves onto a regular H, Hr grid.
 *
 *  All points of a reversal curve share the same reversal field Hr (the first
 *  field value of the curve), so the scattered data lie on lines of constant Hr.
 *  The interpolation is therefore done in two one-dimensional passes: First,
 *  each curve is interpolated along H onto the grid columns; then each grid
 *  column is interpolated along Hr (across the curves) onto the grid rows.
 *  Where a grid column lies below the start of the next curve, its samples are
 *  complemented by the point on the diagonal H = Hr, interpolated between the
 *  first points of the two curves (as in a triangulation of the data).
 *
 *  Interpolation methods:
 *  - NEAREST: Value of the nearest sample; also extrapolates beyond the data.
 *  - LINEAR: Piecewise linear between valid (non-NaN) samples; NaN outside.
 *  - CUBIC: Cubic spline through each range of valid samples; NaN outside.
 *  Finally, all grid cells with H < Hr (not measured) are set to NaN.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcInterpolator {
    /** Interpolation methods */
    public static final int NEAREST = 0, LINEAR = 1, CUBIC = 2;
    /** Maximum number of grid points along one axis */
    public static final int MAX_AXIS_POINTS = 100000;
    /** Names of the interpolation methods, as used in the keyword lookup */
    public static final String[] METHOD_NAMES = new String[] {"nearest", "linear", "cubic"};

    /** Returns the interpolation method for a given name (case-insensitive)
     *  @throws UnsupportedOperationException if there is no such method */
    public static int getMethod(String name) {
        for (int i=0; i<METHOD_NAMES.length; i++)
            if (METHOD_NAMES[i].equalsIgnoreCase(name))
                return i;
        throw new UnsupportedOperationException("Interpolation method not implemented: "+name);
    }

    /** Pipeline stage: Interpolates the raw data onto a regular grid, with the
     *  step and interpolation method given by the configuration.
     *  The FORC distribution of the output is empty.
     *  @throws IllegalArgumentException if there are no raw data */
    public static ForcData interpolate(ForcData data, ForcConfig config) {
        double[][] hRaw = data.getHRaw();
        double[][] mRaw = data.getMRaw();
        double[][] tRaw = data.getTRaw();
        int[] curveOrder = getCurveOrder(hRaw);
        if (curveOrder.length == 0)
            throw new IllegalArgumentException("No data to interpolate");

        double step = config.getStep();
        if (!(step > 0) || Double.isInfinite(step))
            step = data.getStep();
        if (!(step > 0))
            throw new IllegalArgumentException("Invalid step for interpolation: "+step);

        double[] hMinMax = ForcUtils.getMinMax(hRaw);
        double[] hrValues = new double[curveOrder.length];
        for (int i=0; i<curveOrder.length; i++)
            hrValues[i] = hRaw[curveOrder[i]][0];
        double[] hAxis  = getAxis(hMinMax[0], hMinMax[1], step);
        double[] hrAxis = getAxis(hrValues[0], hrValues[hrValues.length-1], step);
        int method = config.getInterpolation();

        double[][] m = interpolateToGrid(hRaw, mRaw, curveOrder, hrValues, hAxis, hrAxis, method);
        boolean hasT = ForcUtils.countNonNaN(tRaw) > 0;
        double[][] t = hasT ?
                interpolateToGrid(hRaw, tRaw, curveOrder, hrValues, hAxis, hrAxis, method) :
                ForcUtils.nanGrid(hrAxis.length, hAxis.length);

        double[][] h = new double[hrAxis.length][];
        double[][] hr = new double[hrAxis.length][hAxis.length];
        for (int i=0; i<hrAxis.length; i++) {
            h[i] = hAxis.clone();
            Arrays.fill(hr[i], hrAxis[i]);
            for (int j=0; j<hAxis.length; j++)
                if (hAxis[j] < hrAxis[i]) {     //not measured
                    m[i][j] = Double.NaN;
                    t[i][j] = Double.NaN;
                }
        }
        if (IJ.debugMode)
            IJ.log("Interpolation ("+METHOD_NAMES[method]+"): step="+(float)step+
                    ", grid "+hAxis.length+"x"+hrAxis.length);
        return data.withGrid(h, hr, m, t);
    }

    /** Returns the axis with (int)(range/step)+1 points from 'first' to 'last',
     *  evenly spaced, including both ends
     *  @throws IllegalArgumentException if the step results in too many points */
    static double[] getAxis(double first, double last, double step) {
        double n = Math.floor((last - first)/step) + 1;
        if (!(n <= MAX_AXIS_POINTS))
            throw new IllegalArgumentException("Step too small for interpolation: "+step+
                    " (range "+(float)(last - first)+")");
        return ForcUtils.linspace(first, last, (int)n);
    }

    /** Returns the indices of the non-empty curves, sorted by ascending reversal
     *  field. For curves with the same reversal field, only the first is kept. */
    static int[] getCurveOrder(final double[][] hRaw) {
        ArrayList<Integer> indices = new ArrayList<Integer>();
        for (int i=0; i<hRaw.length; i++)
            if (hRaw[i].length > 0 && !Double.isNaN(hRaw[i][0]))
                indices.add(i);
        indices.sort(new Comparator<Integer>() {     //stable sort, keeps the first of equal ones first
            public int compare(Integer a, Integer b) {
                return Double.compare(hRaw[a][0], hRaw[b][0]);
            }});
        int[] out = new int[indices.size()];
        int n = 0;
        for (int i : indices)
            if (n == 0 || hRaw[i][0] != hRaw[out[n-1]][0])
                out[n++] = i;
        return Arrays.copyOf(out, n);
    }

    /** Interpolates the values (M or T) of the curves in the given order onto the grid.
     *  The 'hrValues' are the reversal fields of these curves (ascending). */
    static double[][] interpolateToGrid(double[][] hRaw, double[][] values, int[] curveOrder,
            double[] hrValues, double[] hAxis, double[] hrAxis, int method) {
        double[][] rows = new double[curveOrder.length][];      //first pass: along H
        for (int c=0; c<curveOrder.length; c++) {
            double[][] xy = sortUnique(hRaw[curveOrder[c]], values[curveOrder[c]]);
            rows[c] = interpolate1D(xy[0], xy[1], hAxis, method);
        }
        double[] diagonal = new double[curveOrder.length];      //values at H = Hr
        for (int c=0; c<curveOrder.length; c++)
            diagonal[c] = values[curveOrder[c]][0];
        double[][] grid = new double[hrAxis.length][hAxis.length];
        double[] column = new double[curveOrder.length];
        for (int j=0; j<hAxis.length; j++) {                   //second pass: along Hr
            for (int c=0; c<curveOrder.length; c++)
                column[c] = rows[c][j];
            double[][] xy = method == NEAREST ?
                    new double[][] {hrValues, column} :
                    addDiagonalPoint(hrValues, column, diagonal, hAxis[j]);
            double[] newColumn = interpolate1D(xy[0], xy[1], hrAxis, method);
            for (int i=0; i<hrAxis.length; i++)
                grid[i][j] = newColumn[i];
        }
        return grid;
    }

    /** For a grid column at field 'h', returns the samples {hr, values} of the column,
     *  complemented by the point at Hr = h on the diagonal if h is between the
     *  reversal fields of curves c and c+1 and curve c+1 has no value at h.
     *  The value of that point is interpolated linearly between the first values
     *  ('diagonal') of curves c and c+1. Returns the input arrays if there is no
     *  such point. */
    static double[][] addDiagonalPoint(double[] hrValues, double[] column, double[] diagonal, double h) {
        int n = hrValues.length;
        int c = -1;
        while (c+1 < n && hrValues[c+1] <= h)
            c++;
        if (c < 0 || c+1 >= n || !Double.isNaN(column[c+1]))
            return new double[][] {hrValues, column};
        double fraction = (h - hrValues[c])/(hrValues[c+1] - hrValues[c]);
        double value = diagonal[c] + fraction*(diagonal[c+1] - diagonal[c]);
        if (fraction < 1e-6 || Double.isNaN(value))  //on the curve start or no diagonal value
            return new double[][] {hrValues, column};
        double[] x = new double[n+1];
        double[] y = new double[n+1];
        System.arraycopy(hrValues, 0, x, 0, c+1);
        System.arraycopy(column, 0, y, 0, c+1);
        x[c+1] = h;
        y[c+1] = value;
        System.arraycopy(hrValues, c+1, x, c+2, n-c-1);
        System.arraycopy(column, c+1, y, c+2, n-c-1);
        return new double[][] {x, y};
    }

    /** Returns the arrays {x, y} sorted by ascending x, where points with NaN x
     *  are removed and only the first point of any duplicate x value is kept. */
    static double[][] sortUnique(final double[] x, double[] y) {
        boolean ascending = true;
        for (int i=1; i<x.length; i++)
            if (!(x[i] > x[i-1])) {
                ascending = false;
                break;
            }
        if (ascending && (x.length == 0 || !Double.isNaN(x[0])))
            return new double[][] {x, y};
        Integer[] indices = new Integer[x.length];
        for (int i=0; i<x.length; i++)
            indices[i] = i;
        Arrays.sort(indices, new Comparator<Integer>() {   //stable sort
            public int compare(Integer a, Integer b) {
                return Double.compare(x[a], x[b]);
            }});
        double[] newX = new double[x.length];
        double[] newY = new double[x.length];
        int n = 0;
        for (int i : indices) {
            if (Double.isNaN(x[i])) continue;
            if (n > 0 && x[i] == newX[n-1]) continue;
            newX[n] = x[i];
            newY[n] = y[i];
            n++;
        }
        return new double[][] {Arrays.copyOf(newX, n), Arrays.copyOf(newY, n)};
    }

    /** Interpolates the data y(x) onto the new x axis. 'x' must be strictly
     *  ascending, 'y' may contain NaN values, which are not used for interpolation.
     *  'newX' must be ascending. Output points where no interpolation is possible
     *  are NaN. */
    static double[] interpolate1D(double[] x, double[] y, double[] newX, int method) {
        double[] newY = new double[newX.length];
        Arrays.fill(newY, Double.NaN);
        if (x.length == 0) return newY;
        if (method == NEAREST) {
            nearestInterpolate(x, y, newX, newY);
            return newY;
        }
        int[] rangeLimits = ForcUtils.getRangeLimits(y);
        if (rangeLimits[0] < 0)                     //input is only NaN
            return newY;
        double eps = 1e-10*(Math.abs(x[0]) + Math.abs(x[x.length-1]) + (newX.length > 1 ? newX[1] - newX[0] : 0));
        for (int iRange=0; iRange<rangeLimits.length/2; iRange++) {
            int rStart = rangeLimits[2*iRange];
            int rEnd = rangeLimits[2*iRange+1];
            int newStart = 0;
            while (newStart < newX.length && newX[newStart] < x[rStart] - eps)
                newStart++;
            int newEnd = newStart;
            while (newEnd < newX.length && newX[newEnd] <= x[rEnd-1] + eps)
                newEnd++;
            if (newEnd - newStart < 1) continue;    //nothing to do in output array
            if (rEnd - rStart == 1)
                Arrays.fill(newY, newStart, newEnd, y[rStart]);
            else if (method == CUBIC && rEnd - rStart > 2)
                splineInterpolate(x, y, newX, newY, rStart, rEnd, newStart, newEnd);
            else
                linearInterpolate(x, y, newX, newY, rStart, rEnd, newStart, newEnd);
        }
        return newY;
    }

    /** Nearest-neighbor interpolation, where NaN values of y are ignored.
     *  For equal distance, the point with lower x is taken. */
    static void nearestInterpolate(double[] x, double[] y, double[] newX, double[] newY) {
        int n = 0;
        double[] validX = new double[x.length], validY = new double[x.length];
        for (int i=0; i<x.length; i++)
            if (!Double.isNaN(y[i])) {
                validX[n] = x[i];
                validY[n] = y[i];
                n++;
            }
        if (n == 0) return;
        int i = 0;
        for (int k=0; k<newX.length; k++) {
            while (i < n-1 && Math.abs(validX[i+1] - newX[k]) < Math.abs(validX[i] - newX[k]))
                i++;
            newY[k] = validY[i];
        }
    }

    /** Linear interpolation, where valid indices of old quantities are firstValid to endValid-1 and
     *  output points in newY are written between newStart to newEnd-1. */
    static void linearInterpolate(double[] x, double[] y, double[] newX, double[] newY,
            int firstValid, int endValid, int newStart, int newEnd) {
        int i = firstValid;
        for (int k=newStart; k<newEnd; k++) {
            while (i < endValid-2 && x[i+1] < newX[k])
                i++;
            double fraction = (newX[k] - x[i])/(x[i+1] - x[i]);
            if (fraction < 0) fraction = 0;         //may be slightly outside due to rounding
            if (fraction > 1) fraction = 1;
            newY[k] = y[i] + fraction*(y[i+1] - y[i]);
        }
    }

    /** Spline interpolation, where valid indices of old quantities are firstValid to endValid-1 and
     *  output points in newY are written between newStart to newEnd-1. */
    static void splineInterpolate(double[] x, double[] y, double[] newX, double[] newY,
            int firstValid, int endValid, int newStart, int newEnd) {
        double x0 = x[firstValid];                  //offset for better accuracy of float values
        float[] xF = new float[endValid - firstValid];
        float[] yF = new float[endValid - firstValid];
        for (int i=firstValid; i<endValid; i++) {
            xF[i-firstValid] = (float)(x[i] - x0);
            yF[i-firstValid] = (float)y[i];
        }
        SplineFitter spline = new SplineFitter(xF, yF, xF.length);
        for (int k=newStart; k<newEnd; k++) {
            double xk = Math.max(x[firstValid], Math.min(x[endValid-1], newX[k]));
            newY[k] = spline.evalSpline(xk - x0);
        }
    }
}
