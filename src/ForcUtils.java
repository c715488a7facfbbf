import ij.IJ;
import ij.util.Tools;
import java.util.Arrays;


/**
 *  This class contains various static utility methods for ragged curve
 *  arrays and regular 2D grids, as used by the FORC processing steps.
 *  Grids are double[][] arrays with the first index for the row (Hr) and the
 *  second index for the column (H).
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcUtils {

    /** Returns the number of non-NaN elements in the array */
    public static int countNonNaN(double[] array) {
        int count = 0;
        for (double x : array)
            if (!Double.isNaN(x)) count++;
        return count;
    }

    /** Returns the number of non-NaN elements in a 2D (possibly ragged) array */
    public static int countNonNaN(double[][] array) {
        int count = 0;
        for (double[] row : array)
            count += countNonNaN(row);
        return count;
    }

    /** Returns the arithmetic mean of the array values (NaN for an empty array) */
    public static double getMean(double[] a) {
        double sum = 0;
        for (double x : a)
            sum += x;
        return sum/a.length;
    }

    /** Returns the median of the array values. For an even number of values,
     *  the mean of the two central values. The input is not modified.
     *  Returns NaN for an empty array. */
    public static double getMedian(double[] a) {
        if (a.length == 0) return Double.NaN;
        double[] sorted = a.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        return (n&1) == 1 ? sorted[n/2] : 0.5*(sorted[n/2-1] + sorted[n/2]);
    }

    /** Returns the minimum and maximum of a 2D array as a two-element array,
     *  ignoring NaN values. Returns {NaN, NaN} if there are no non-NaN values. */
    public static double[] getMinMax(double[][] a) {
        double min = Double.NaN, max = Double.NaN;
        for (double[] row : a) {
            double[] minMax = Tools.getMinMax(row);
            if (!(minMax[0] >= min)) min = Double.isNaN(minMax[0]) ? min : minMax[0];
            if (!(minMax[1] <= max)) max = Double.isNaN(minMax[1]) ? max : minMax[1];
        }
        return new double[] {min, max};
    }

    /** Creates an array with the sequence from 0 to length-1 */
    public static double[] createSequence(int length) {
        double[] out = new double[length];
        for (int i=0; i<length; i++)
            out[i] = i;
        return out;
    }

    /** Returns 'n' evenly spaced values from 'first' to 'last' (both inclusive).
     *  For n=1, the only value is 'first'. */
    public static double[] linspace(double first, double last, int n) {
        double[] out = new double[n];
        double step = n > 1 ? (last - first)/(n - 1) : 0;
        for (int i=0; i<n; i++)
            out[i] = first + i*step;
        if (n > 1) out[n-1] = last;     //avoid rounding errors at the end
        return out;
    }

    /** Creates a grid (height rows, width columns) filled with NaN */
    public static double[][] nanGrid(int height, int width) {
        double[][] out = new double[height][width];
        for (double[] row : out)
            Arrays.fill(row, Double.NaN);
        return out;
    }

    /** Returns whether two 2D arrays have the same (rectangular) shape */
    public static boolean sameShape(double[][] a, double[][] b) {
        if (a.length != b.length) return false;
        for (int i=0; i<a.length; i++)
            if (a[i].length != b[i].length) return false;
        return true;
    }

    /** Returns the limits of valid data as an array {start, end, start, end, ...}
     *  where the valid (non-NaN) data of each range run from start to end-1.
     *  Returns a two-element array with -1 as start limit if zero range. */
    public static int[] getRangeLimits(double[] data) {
        int[] limits = new int[2];      //in most cases, there are only two limits
        int nLimits = 0;
        int rangeStart = -1;
        for (int i=0; i<=data.length; i++) {
            boolean isNaN = i==data.length || Double.isNaN(data[i]);
            if (rangeStart < 0 && !isNaN)
                rangeStart = i;
            else if (rangeStart>=0 && isNaN) { //end of range of valid (non-NaN) data
                if (nLimits + 2 > limits.length)
                    limits = Arrays.copyOf(limits, 2*limits.length);
                limits[nLimits++] = rangeStart;
                limits[nLimits++] = i;  //range end (exclusive)
                rangeStart = -1;
            }
        }
        if (nLimits > 0)
            return nLimits == limits.length ? limits : Arrays.copyOf(limits, nLimits);
        else
            return new int[] {-1, 0};
    }

    /** Returns the index of the first non-NaN element, or -1 if all are NaN */
    public static int firstNonNaN(double[] a) {
        for (int i=0; i<a.length; i++)
            if (!Double.isNaN(a[i])) return i;
        return -1;
    }

    /** Inverts a symmetric positive definite n*n matrix (such as the matrix of
     *  the normal equations of a least-squares fit) via its Cholesky decomposition;
     *  the matrix is replaced by its inverse.
     *  Returns false if the matrix is singular (or not positive definite); then
     *  the matrix is unchanged. */
    public static boolean invertSymmetricMatrix(double[][] matrix) {
        int n = matrix.length;
        if (n > 0 && matrix[0].length != n)
            throw new IllegalArgumentException("Not a square matrix: "+n+"x"+matrix[0].length);
        double maxDiagonal = 0;
        for (int i=0; i<n; i++)
            maxDiagonal = Math.max(maxDiagonal, Math.abs(matrix[i][i]));
        double[][] l = new double[n][n];        //lower triangular, matrix = l * l^T
        for (int i=0; i<n; i++)
            for (int j=0; j<=i; j++) {
                double sum = matrix[i][j];
                for (int k=0; k<j; k++)
                    sum -= l[i][k]*l[j][k];
                if (i == j) {
                    if (!(sum > 1e-14*maxDiagonal)) {
                        if (IJ.debugMode) IJ.log("singular "+n+"x"+n+" matrix at row "+i);
                        return false;
                    }
                    l[i][i] = Math.sqrt(sum);
                } else
                    l[i][j] = sum/l[j][j];
            }
        double[][] lInv = new double[n][n];
        for (int i=0; i<n; i++) {
            lInv[i][i] = 1./l[i][i];
            for (int j=0; j<i; j++) {
                double sum = 0;
                for (int k=j; k<i; k++)
                    sum -= l[i][k]*lInv[k][j];
                lInv[i][j] = sum/l[i][i];
            }
        }
        for (int i=0; i<n; i++)                 //inverse = lInv^T * lInv
            for (int j=0; j<=i; j++) {
                double sum = 0;
                for (int k=i; k<n; k++)
                    sum += lInv[k][i]*lInv[k][j];
                matrix[i][j] = sum;
                matrix[j][i] = sum;
            }
        return true;
    }
}
