import java.util.Arrays;

/**
 *  Fits a linear multi-parameter function to data
 *    y = b0*x0 + b1*x1 + ...
 *  where x0, x1, ... are n independent variables (basis function values)
 *  and b0, b1, ... are the parameters; these should be determined.
 *
 *  Besides the fit parameters, the fitter can provide the weights with which
 *  a data point enters each parameter, i.e., the rows of the pseudo-inverse
 *  of the design matrix. Since the fit is linear in y, any parameter is the
 *  sum of these weights times the y values. This is used for deriving
 *  convolution kernels from local polynomial fits.
 *
 *  Note that numeric stability is limited; especially for large numbers
 *  of parameters the x values should be scaled such that they have
 *  root-mean-square values around 1.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcMultiVariateFitter {
    private int n;                      //number of parameters
    private int count;                  //number of data points
    private double[][] sumXiXj;
    private double[] sumXiY;
    private double[][] inverse = null;  //inverse of the normal equation matrix, null if not calculated
    private double[] parameters = null; //the final parameters

    /** Constructor, sets the number of parameters */
    public ForcMultiVariateFitter(int nParams) {
        this.n = nParams;
        sumXiXj = new double[n][n];
        sumXiY  = new double[n];
    }

    /** Adds a data point with a given experimental value and the x values.
     *  The array size of x must be equal to the number of parameters */
    public void addPoint(double expY, double[] x) {
        if (x.length != n)
            throw new IllegalArgumentException("Fitter for "+n+" parameters, got "+x.length+" x values");
        for (int i=0; i<n; i++) {
            sumXiY[i] += expY*x[i];
            sumXiXj[i][i] += x[i]*x[i];
            for (int j=0; j<i; j++)
                sumXiXj[i][j] += x[i]*x[j];
        }
        count++;
        inverse = null;
        parameters = null;
    }

    /** Returns the number of data points */
    public int getNPoints() {
        return count;
    }

    /** Returns the inverse of the normal-equation matrix, or null if singular */
    private double[][] getInverse() {
        if (inverse == null) {
            double[][] matrix = new double[n][n];
            for (int i=0; i<n; i++)     //complete the symmetric matrix
                for (int j=0; j<=i; j++) {
                    matrix[i][j] = sumXiXj[i][j];
                    matrix[j][i] = sumXiXj[i][j];
                }
            if (!ForcUtils.invertSymmetricMatrix(matrix))
                return null;
            inverse = matrix;
        }
        return inverse;
    }

    /** Returns the fit parameters. All parameters are NaN if the fit is
     *  underdetermined (singular matrix). */
    public double[] getFitParameters() {
        if (parameters == null) {
            parameters = new double[n];
            double[][] inv = getInverse();
            if (inv != null) {
                for (int i=0; i<n; i++)
                    for (int j=0; j<n; j++)
                        parameters[i] += inv[i][j]*sumXiY[j];
            } else
                Arrays.fill(parameters, Double.NaN);
        }
        return parameters;
    }

    /** Returns the weights of a data point with the given x values for each of
     *  the fit parameters, i.e., the column of the pseudo-inverse (A^T A)^-1 A^T
     *  belonging to that point. The y values added so far are irrelevant.
     *  Returns an array of NaN values if the fit is underdetermined. */
    public double[] getParameterWeights(double[] x) {
        double[] weights = new double[n];
        double[][] inv = getInverse();
        if (inv == null) {
            Arrays.fill(weights, Double.NaN);
            return weights;
        }
        for (int i=0; i<n; i++)
            for (int j=0; j<n; j++)
                weights[i] += inv[i][j]*x[j];
        return weights;
    }
}
