import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ForcData}.
 */
class ForcDataTest {

    @Test
    @DisplayName("Step is the median of the field differences")
    void getStep_median() {
        assertEquals(1, ForcTestData.triangle().getStep(), 0);

        double[][] h = new double[][] {{0, 1, 3}, {5}, {0, 2, 4, 4.5}};
        ForcData data = new ForcData("steps", h, h, h, new double[3]);
        assertEquals(2, data.getStep(), 0);     //differences 1, 2, 2, 2, 0.5

        double[][] single = new double[][] {{1}};
        ForcData noStep = new ForcData("single", single, single, single, new double[1]);
        assertThrows(IllegalArgumentException.class, noStep::getStep);
    }

    @Test
    @DisplayName("with...() copies share the untouched arrays")
    void with_sharesArrays() {
        ForcData data = ForcTestData.triangle();
        double[][] newM = new double[][] {{0, 0, 0}, {0, 0, 0, 0}, {0, 0, 0, 0, 0}};

        ForcData copy = data.withMRaw(newM);

        assertNotSame(data, copy);
        assertSame(newM, copy.getMRaw());
        assertSame(data.getHRaw(), copy.getHRaw());
        assertSame(data.getTRaw(), copy.getTRaw());
        assertSame(data.getMDrift(), copy.getMDrift());
        assertEquals(1, data.getMRaw()[0][0], 0);   //original unchanged
    }

    @Test
    @DisplayName("Inconsistent arrays are rejected")
    void constructor_inconsistent() {
        double[][] h = new double[][] {{1, 2}};
        double[][] m = new double[][] {{1, 2, 3}};
        assertThrows(IllegalArgumentException.class, () -> new ForcData("bad", h, m, h, new double[1]));
        assertThrows(IllegalArgumentException.class, () -> ForcTestData.triangle().withMRaw(m));

        ForcData grid = ForcTestData.grid(0, 2, 0, 2, 1, true, (x, y) -> x);
        assertThrows(IllegalArgumentException.class, () -> grid.withM(new double[2][3]));
    }

    @Test
    @DisplayName("New grid discards the FORC distribution")
    void withGrid_dropsRho() {
        ForcData data = ForcTestData.grid(0, 2, 0, 2, 1, true, (x, y) -> x);
        ForcData withRho = data.withRho(new double[3][3]);
        assertTrue(withRho.hasRho());

        ForcData regridded = withRho.withGrid(data.getH(), data.getHr(), data.getM(), data.getT());

        assertFalse(regridded.hasRho());
        assertTrue(regridded.hasGrid());
    }

    @Test
    @DisplayName("Masked curves contain H >= Hr only")
    void curves_masked() {
        ForcData data = ForcTestData.grid(-1, 3, -1, 1, 1, true, (h, hr) -> 10*h);

        double[][][] masked = data.curves(true);
        double[][][] all = data.curves(false);

        assertEquals(3, masked.length);
        assertArrayEquals(new double[] {1, 2, 3}, masked[2][0], 0);
        assertArrayEquals(new double[] {10, 20, 30}, masked[2][1], 0);
        assertEquals(5, masked[0][0].length);
        assertEquals(5, all[2][0].length);
        assertTrue(Double.isNaN(all[2][1][0]));
    }

    @Test
    @DisplayName("Extent and limits, masked and unmasked")
    void extentAndLimits() {
        ForcData data = ForcTestData.grid(-1, 3, -1, 1, 1, true, (h, hr) -> h);

        assertArrayEquals(new double[] {-1, 3, -1, 1}, data.getExtent(false), 0);
        assertArrayEquals(new double[] {-1, 3, -1, 1}, data.getExtent(true), 0);

        double[][] hcHb = data.getLimits(ForcCoordinates.HC_HB, true);
        assertArrayEquals(new double[] {0, 2}, hcHb[0], 1e-15);      //Hc
        assertArrayEquals(new double[] {-1, 2}, hcHb[1], 1e-15);     //Hb
        double[][] hcHbAll = data.getLimits(ForcCoordinates.HC_HB, false);
        assertEquals(-1, hcHbAll[0][0], 1e-15);                       //H=-1, Hr=1

        ForcData upper = ForcTestData.grid(0, 1, 1, 3, 1, true, (h, hr) -> h);
        assertArrayEquals(new double[] {0, 1, 1, 3}, upper.getExtent(false), 0);
        assertArrayEquals(new double[] {1, 1, 1, 1}, upper.getExtent(true), 0);
    }

    @Test
    @DisplayName("Grid queries need a grid")
    void gridQueries_needGrid() {
        ForcData raw = ForcTestData.triangle();

        assertFalse(raw.hasGrid());
        assertThrows(IllegalArgumentException.class, () -> raw.getExtent(true));
        assertThrows(IllegalArgumentException.class, () -> raw.curves(false));
        assertThrows(IllegalArgumentException.class, raw::getGridStepH);
    }

    @Test
    @DisplayName("Grid steps")
    void gridSteps() {
        ForcData data = ForcTestData.grid(0, 2, -1, 1, 0.5, true, (h, hr) -> h);

        assertEquals(0.5, data.getGridStepH(), 1e-15);
        assertEquals(0.5, data.getGridStepHr(), 1e-15);
    }
}
