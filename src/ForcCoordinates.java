/**
 *  Affine coordinate transformations between the measurement coordinates
 *  (H, Hr) and other coordinate systems, most notably the coercive/bias
 *  field coordinates (Hc, Hb) with
 *    Hc = (H - Hr)/2,   Hb = (H + Hr)/2,
 *  and the inverse
 *    H = Hb + Hc,       Hr = Hb - Hc.
 *
 *  A transformation is given by a 2x3 matrix {{a, b, c}, {d, e, f}} with
 *  x' = a*x + b*y + c and y' = d*x + e*y + f.
 *  Objects of this class are immutable.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcCoordinates {
    /** The measurement coordinates (H, Hr); the identity transformation */
    public static final ForcCoordinates H_HR = new ForcCoordinates("hhr",
            new double[][] {{1, 0, 0}, {0, 1, 0}});
    /** Coercive and bias field coordinates (Hc, Hb) */
    public static final ForcCoordinates HC_HB = new ForcCoordinates("hchb",
            new double[][] {{0.5, -0.5, 0}, {0.5, 0.5, 0}});
    /** All named coordinate systems, for lookup by name */
    private static final ForcCoordinates[] NAMED = new ForcCoordinates[] {H_HR, HC_HB};

    private final String name;
    private final double a, b, c, d, e, f;

    /** Creates a transformation from a 2x3 matrix {{a, b, c}, {d, e, f}}.
     *  The name may be null for anonymous transformations. */
    public ForcCoordinates(String name, double[][] matrix) {
        if (matrix.length != 2 || matrix[0].length != 3 || matrix[1].length != 3)
            throw new IllegalArgumentException("Affine transformation needs a 2x3 matrix");
        this.name = name;
        a = matrix[0][0]; b = matrix[0][1]; c = matrix[0][2];
        d = matrix[1][0]; e = matrix[1][1]; f = matrix[1][2];
    }

    /** Returns the coordinate system with the given name, 'hhr' or 'hchb'.
     *  @throws IllegalArgumentException for an unknown name */
    public static ForcCoordinates fromString(String name) {
        for (ForcCoordinates coords : NAMED)
            if (coords.name.equals(name))
                return coords;
        throw new IllegalArgumentException("Invalid coordinate type "+name);
    }

    /** Returns the name, or null for an anonymous transformation */
    public String getName() {
        return name;
    }

    /** Returns a copy of the 2x3 transformation matrix */
    public double[][] getMatrix() {
        return new double[][] {{a, b, c}, {d, e, f}};
    }

    /** Returns the transformed point {x', y'} */
    public double[] transform(double x, double y) {
        return new double[] {a*x + b*y + c, d*x + e*y + f};
    }

    /** Transforms an array of points, each point given as {x, y}.
     *  Returns a new array with the transformed points. */
    public double[][] transform(double[][] points) {
        double[][] out = new double[points.length][];
        for (int i=0; i<points.length; i++)
            out[i] = transform(points[i][0], points[i][1]);
        return out;
    }

    /** Returns the determinant of the linear part */
    private double getDeterminant() {
        return a*e - b*d;
    }

    /** Returns whether the transformation can be inverted */
    public boolean isInvertible() {
        double det = getDeterminant();
        return det != 0 && !Double.isNaN(det) && !Double.isInfinite(det);
    }

    /** Returns the inverse transformation.
     *  @throws IllegalArgumentException if the transformation is singular */
    public ForcCoordinates inverse() {
        if (!isInvertible())
            throw new IllegalArgumentException("Coordinate transformation not invertible");
        double det = getDeterminant();
        double ia =  e/det, ib = -b/det;
        double id = -d/det, ie =  a/det;
        return new ForcCoordinates(null, new double[][] {
            {ia, ib, -(ia*c + ib*f)},
            {id, ie, -(id*c + ie*f)}});
    }

    /** Returns the transformation that first applies this transformation,
     *  then 'other' */
    public ForcCoordinates concatenate(ForcCoordinates other) {
        return new ForcCoordinates(null, new double[][] {
            {other.a*a + other.b*d, other.a*b + other.b*e, other.a*c + other.b*f + other.c},
            {other.d*a + other.e*d, other.d*b + other.e*e, other.d*c + other.e*f + other.f}});
    }

    /** String representation */
    public String toString() {
        return "ForcCoordinates"+(name == null ? "" : " '"+name+"'")+
                " ["+(float)a+", "+(float)b+", "+(float)c+"; "+(float)d+", "+(float)e+", "+(float)f+"]";
    }
}
