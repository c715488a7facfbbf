/**
 *  Linear regression y = offset + slope*x for a single function of one variable.
 *  Used for extrapolating the magnetization rows at the low-field side
 *  before computing the FORC distribution.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcLinearRegression {
    /** number of data points */
    protected int counter = 0;
    /** sum of all x values*/
    protected double sumX = 0;
    /** sum of all y values*/
    protected double sumY = 0;
    /** sum of all x*y products*/
    protected double sumXY = 0;
    /** sum of all squares of x*/
    protected double sumX2 = 0;
    /** result of the regression: offset */
    protected double offset = Double.NaN;
    /** result of the regression: slope */
    protected double slope = Double.NaN;
    /** whether the results (offset, slope) have been calculated already */
    protected boolean calculated = false;

    /** Add a point x,y unless any value is NaN */
    public void addPoint(double x, double y) {
        if (Double.isNaN(x) || Double.isNaN(y)) return;
        counter++;
        sumX += x;
        sumY += y;
        sumXY += x*y;
        sumX2 += x*x;
        calculated = false;
    }

    /** Calculates offset and slope from the sums */
    private void reCalculate() {
        if (counter>0) {
            double stdX2TimesN = sumX2-sumX*sumX*(1./counter);
            slope = (sumXY-sumX*sumY*(1./counter))/stdX2TimesN;
            if (Double.isNaN(slope) || Double.isInfinite(slope))
                slope = 0;                              //slope 0 if fit was unsuccessful (e.g. one point)
        } else
            slope = Double.NaN;
        offset = (sumY-slope*sumX)/counter;
        calculated = true;
    }

    /** Returns the fit function value at a given x */
    public double getFitValue(double x) {
        if (!calculated) reCalculate();
        return offset + x*slope;
    }

    /** Get the number of points */
    public int getCounter() {return counter;}
}
