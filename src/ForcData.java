/**
 *  This class contains FORC data, i.e., a snapshot of the processing pipeline:
 *  The raw curves as ingested (field, moment and temperature for each curve,
 *  plus one drift magnetization value per curve) and the data on a regular
 *  grid: fields H and Hr, magnetization M, temperature T, and the FORC
 *  distribution rho.
 *
 *  The raw data are ragged arrays, one row per curve, never padded.
 *  The grids are double[nHr][nH] arrays, i.e., one row for each reversal field;
 *  they are double[0][0] before interpolation (and rho before computing
 *  the FORC distribution). Where H < Hr, the grid values of M, T and rho are NaN.
 *
 *  ForcData objects are never modified. The 'with...' methods return a
 *  shallow clone where only the given fields are replaced; all other arrays
 *  are shared with the original. Thus, never modify the arrays obtained
 *  from a ForcData object.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcData implements Cloneable {
    private static final double[][] EMPTY_GRID = new double[0][0];
    /** Typically the name of the file where the data were read */
    private String title;
    private double[][] hRaw, mRaw, tRaw;
    private double[] mDrift;
    private double[][] h = EMPTY_GRID, hr = EMPTY_GRID, m = EMPTY_GRID, t = EMPTY_GRID;
    private double[][] rho = EMPTY_GRID;

    /** Creates a ForcData object with raw data only. The arrays hRaw, mRaw, tRaw
     *  must have the same number of rows (curves) and each curve the same length
     *  in all three. 'mDrift' may have one value per curve or may be empty. */
    public ForcData(String title, double[][] hRaw, double[][] mRaw, double[][] tRaw, double[] mDrift) {
        checkRaw(hRaw, mRaw, tRaw);
        this.title = title;
        this.hRaw = hRaw;
        this.mRaw = mRaw;
        this.tRaw = tRaw;
        this.mDrift = mDrift;
    }

    /** Ensures that the raw arrays are consistent */
    private static void checkRaw(double[][] hRaw, double[][] mRaw, double[][] tRaw) {
        if (hRaw.length != mRaw.length || hRaw.length != tRaw.length)
            throw new IllegalArgumentException("Raw data: number of curves differ for H, M, T: "+
                    hRaw.length+", "+mRaw.length+", "+tRaw.length);
        for (int i=0; i<hRaw.length; i++)
            if (hRaw[i].length != mRaw[i].length || hRaw[i].length != tRaw[i].length)
                throw new IllegalArgumentException("Raw data: length mismatch of H, M, T in curve "+i);
    }

    /** Ensures that a grid has the same shape as the H grid */
    private void checkGrid(double[][] grid, String name) {
        if (!ForcUtils.sameShape(h, grid))
            throw new IllegalArgumentException("Grid "+name+" has a shape different from the H grid");
    }

    /** Returns a shallow clone; no array contents are cloned.
     *  Thus, do not modify arrays of a clone, only replace them. */
    private ForcData shallowClone() {
        try {
            return (ForcData)this.clone();
        } catch (CloneNotSupportedException e) {
            throw new RuntimeException(e);      //cannot happen, we are Cloneable
        }
    }

    /** Returns a copy with the raw data replaced */
    public ForcData withRaw(double[][] hRaw, double[][] mRaw, double[][] tRaw, double[] mDrift) {
        checkRaw(hRaw, mRaw, tRaw);
        ForcData data = shallowClone();
        data.hRaw = hRaw;
        data.mRaw = mRaw;
        data.tRaw = tRaw;
        data.mDrift = mDrift;
        return data;
    }

    /** Returns a copy with the raw magnetization replaced */
    public ForcData withMRaw(double[][] mRaw) {
        checkRaw(hRaw, mRaw, tRaw);
        ForcData data = shallowClone();
        data.mRaw = mRaw;
        return data;
    }

    /** Returns a copy with the drift magnetization values replaced */
    public ForcData withMDrift(double[] mDrift) {
        ForcData data = shallowClone();
        data.mDrift = mDrift;
        return data;
    }

    /** Returns a copy with new grids of H, Hr, M, T, which must have the same shape.
     *  The FORC distribution rho of the copy is empty, as it would not match the new grid. */
    public ForcData withGrid(double[][] h, double[][] hr, double[][] m, double[][] t) {
        ForcData data = shallowClone();
        data.h = h;
        data.hr = hr;
        data.m = m;
        data.t = t;
        data.rho = EMPTY_GRID;
        data.checkGrid(hr, "Hr");
        data.checkGrid(m, "M");
        data.checkGrid(t, "T");
        return data;
    }

    /** Returns a copy with the magnetization grid replaced */
    public ForcData withM(double[][] m) {
        checkGrid(m, "M");
        ForcData data = shallowClone();
        data.m = m;
        return data;
    }

    /** Returns a copy with the FORC distribution grid replaced */
    public ForcData withRho(double[][] rho) {
        checkGrid(rho, "rho");
        ForcData data = shallowClone();
        data.rho = rho;
        return data;
    }

    public String getTitle()       { return title; }
    public double[][] getHRaw()    { return hRaw; }
    public double[][] getMRaw()    { return mRaw; }
    public double[][] getTRaw()    { return tRaw; }
    public double[] getMDrift()    { return mDrift; }
    public double[][] getH()       { return h; }
    public double[][] getHr()      { return hr; }
    public double[][] getM()       { return m; }
    public double[][] getT()       { return t; }
    public double[][] getRho()     { return rho; }

    /** Returns the number of raw curves */
    public int getNCurves() {
        return hRaw.length;
    }

    /** Returns whether the data have a regular grid (i.e., were interpolated) */
    public boolean hasGrid() {
        return h.length > 0 && h[0].length > 0;
    }

    /** Returns whether the FORC distribution has been computed */
    public boolean hasRho() {
        return rho.length > 0 && rho[0].length > 0;
    }

    /** Returns the step of the raw data: the median of the differences between
     *  subsequent field values within each curve.
     *  @throws IllegalArgumentException if no curve has at least two points */
    public double getStep() {
        int n = 0;
        for (double[] curve : hRaw)
            if (curve.length > 1) n += curve.length - 1;
        if (n == 0)
            throw new IllegalArgumentException("Cannot determine the step; no curve with more than one point");
        double[] diffs = new double[n];
        int p = 0;
        for (double[] curve : hRaw)
            for (int i=1; i<curve.length; i++)
                diffs[p++] = curve[i] - curve[i-1];
        return ForcUtils.getMedian(diffs);
    }

    /** Returns the spacing of the H grid (columns), NaN if less than two columns */
    public double getGridStepH() {
        requireGrid();
        return h[0].length > 1 ? h[0][1] - h[0][0] : Double.NaN;
    }

    /** Returns the spacing of the Hr grid (rows), NaN if less than two rows */
    public double getGridStepHr() {
        requireGrid();
        return hr.length > 1 ? hr[1][0] - hr[0][0] : Double.NaN;
    }

    /** Returns the curves of the grid, one for each grid row (i.e., reversal field),
     *  each as an array {hValues, mValues}. With 'masked', only points with H >= Hr
     *  are included. */
    public double[][][] curves(boolean masked) {
        requireGrid();
        double[][][] out = new double[h.length][][];
        for (int i=0; i<h.length; i++) {
            int n = 0;
            for (int j=0; j<h[i].length; j++)
                if (!masked || h[i][j] >= hr[i][j]) n++;
            double[] hValues = new double[n];
            double[] mValues = new double[n];
            int p = 0;
            for (int j=0; j<h[i].length; j++)
                if (!masked || h[i][j] >= hr[i][j]) {
                    hValues[p] = h[i][j];
                    mValues[p] = m[i][j];
                    p++;
                }
            out[i] = new double[][] {hValues, mValues};
        }
        return out;
    }

    /** Returns the extent of the grid, {minH, maxH, minHr, maxHr}.
     *  With 'masked', only grid points with H >= Hr are considered. */
    public double[] getExtent(boolean masked) {
        double[][] limits = getLimits(ForcCoordinates.H_HR, masked);
        return new double[] {limits[0][0], limits[0][1], limits[1][0], limits[1][1]};
    }

    /** Returns the limits {{xMin, xMax}, {yMin, yMax}} of the grid points
     *  transformed into the given coordinates, e.g. {{HcMin, HcMax}, {HbMin, HbMax}}.
     *  With 'masked', only grid points with H >= Hr are considered.
     *  All limits are NaN if there are no such points. */
    public double[][] getLimits(ForcCoordinates coords, boolean masked) {
        requireGrid();
        double xMin = Double.NaN, xMax = Double.NaN, yMin = Double.NaN, yMax = Double.NaN;
        for (int i=0; i<h.length; i++)
            for (int j=0; j<h[i].length; j++) {
                if (masked && !(h[i][j] >= hr[i][j])) continue;
                double[] xy = coords.transform(h[i][j], hr[i][j]);
                if (!(xy[0] >= xMin)) xMin = xy[0];
                if (!(xy[0] <= xMax)) xMax = xy[0];
                if (!(xy[1] >= yMin)) yMin = xy[1];
                if (!(xy[1] <= yMax)) yMax = xy[1];
            }
        return new double[][] {{xMin, xMax}, {yMin, yMax}};
    }

    /** Throws an IllegalArgumentException if there is no grid yet */
    void requireGrid() {
        if (!hasGrid())
            throw new IllegalArgumentException("No grid data; interpolate the data first");
    }

    /** String representation */
    public String toString() {
        String out = "ForcData '"+title+"': "+getNCurves()+" curves";
        if (hasGrid())
            out += ", grid "+h[0].length+"x"+h.length;
        if (hasRho())
            out += ", with FORC distribution";
        return out;
    }
}
