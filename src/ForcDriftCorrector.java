import ij.IJ;
import ij.measure.SplineFitter;
import ij.util.Tools;
import java.util.Arrays;

/**
 *  Corrects the raw magnetization for slow drift of the instrument.
 *
 *  Each curve has one drift value, a magnetization measured in saturation.
 *  These values are smoothed by a moving average (half width k), the smoothed
 *  values at every n-th curve (and the last one) are connected by a cubic
 *  spline, and for each curve, the deviation of the spline from the average
 *  drift value is subtracted from all magnetization values of that curve.
 *  Only the raw data are affected; the grid data are not touched.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcDriftCorrector {

    /** Pipeline stage: Corrects the raw magnetization and the drift values,
     *  with the moving-average half width and decimation given by the configuration.
     *  @throws IllegalArgumentException if there are no drift values */
    public static ForcData correctDrift(ForcData data, ForcConfig config) {
        double[] mDrift = data.getMDrift();
        if (mDrift == null || mDrift.length == 0)
            throw new IllegalArgumentException("No drift points in dataset.");
        double[][] mRaw = data.getMRaw();
        if (mDrift.length != mRaw.length)
            throw new IllegalArgumentException("Number of drift points ("+mDrift.length+
                    ") does not match the number of curves ("+mRaw.length+")");

        double[] offsets = getOffsets(mDrift, config.getDriftKernelSize(), config.getDriftDensity());
        double[][] newMRaw = new double[mRaw.length][];
        double[] newMDrift = new double[mDrift.length];
        for (int i=0; i<mRaw.length; i++) {
            newMRaw[i] = new double[mRaw[i].length];
            for (int j=0; j<mRaw[i].length; j++)
                newMRaw[i][j] = mRaw[i][j] - offsets[i];
            newMDrift[i] = mDrift[i] - offsets[i];
        }
        if (IJ.debugMode) {
            double[] minMax = Tools.getMinMax(offsets);
            IJ.log("Drift correction: offsets from "+(float)minMax[0]+" to "+(float)minMax[1]);
        }
        return data.withMRaw(newMRaw).withMDrift(newMDrift);
    }

    /** Returns the drift offset for each curve: the smoothed, decimated and
     *  spline-interpolated drift values minus their average */
    static double[] getOffsets(double[] mDrift, int kernelSize, int density) {
        double average = ForcUtils.getMean(mDrift);
        double[] smoothed = decimate(movingAverage(mDrift, kernelSize), density);
        double[] indices = decimate(ForcUtils.createSequence(mDrift.length), density);
        double[] offsets = new double[mDrift.length];
        if (indices.length == 1) {                  //single point: constant
            Arrays.fill(offsets, smoothed[0] - average);
            return offsets;
        }
        float[] xF = new float[indices.length];
        float[] yF = new float[indices.length];
        double y0 = smoothed[0];                    //subtract for better accuracy of float values
        for (int i=0; i<indices.length; i++) {
            xF[i] = (float)indices[i];
            yF[i] = (float)(smoothed[i] - y0);
        }
        SplineFitter spline = new SplineFitter(xF, yF, xF.length);
        for (int i=0; i<offsets.length; i++)
            offsets[i] = spline.evalSpline(i) + y0 - average;
        return offsets;
    }

    /** Moving average with a window of 2*radius+1 points, where the data are
     *  continued with the first and last value at the edges */
    static double[] movingAverage(double[] a, int radius) {
        int n = a.length;
        double[] out = new double[n];
        double norm = 1.0/(2*radius+1);
        for (int i=0; i<n; i++) {
            double sum = 0;
            for (int k=i-radius; k<=i+radius; k++)
                sum += a[k < 0 ? 0 : (k >= n ? n-1 : k)];
            out[i] = sum*norm;
        }
        return out;
    }

    /** Returns every 'step'-th element of the array, starting with the first;
     *  the last element is always included. */
    static double[] decimate(double[] a, int step) {
        int n = (a.length - 1)/step + 1;
        boolean addLast = (a.length - 1) % step != 0;
        double[] out = new double[addLast ? n+1 : n];
        for (int i=0; i<n; i++)
            out[i] = a[i*step];
        if (addLast)
            out[n] = a[a.length-1];
        return out;
    }
}
