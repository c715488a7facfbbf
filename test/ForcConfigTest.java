import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ForcConfig}.
 */
class ForcConfigTest {

    @Test
    @DisplayName("Default values")
    void defaults() {
        ForcConfig config = ForcConfig.defaults();

        assertNull(config.getFilePath());
        assertTrue(Double.isNaN(config.getStep()));
        assertEquals(ForcInterpolator.CUBIC, config.getInterpolation());
        assertTrue(config.isDriftCorrection());
        assertEquals(4, config.getDriftKernelSize());
        assertEquals(3, config.getDriftDensity());
        assertEquals(0, config.getHSat(), 0);
        assertTrue(Double.isNaN(config.getSlope()));
        assertEquals(3, config.getSmoothingFactor());
        assertEquals(ForcDistribution.EXTENSION_NONE, config.getExtension());
        assertEquals(5, config.getExtensionFitPoints());
        assertEquals(2, config.getPipeline().size());
    }

    @Test
    @DisplayName("Default pipeline without drift correction")
    void defaultPipeline_noDrift() {
        ForcConfig config = new ForcConfig.Builder().driftCorrection(false).build();

        assertEquals(1, config.getPipeline().size());
        ForcData data = config.getPipeline().get(0).apply(ForcTestData.triangle(), config);
        assertTrue(data.hasGrid());
    }

    @Test
    @DisplayName("Keywords for interpolation and extension")
    void builder_keywords() {
        ForcConfig config = new ForcConfig.Builder().interpolation("nearest").extension("linear").build();

        assertEquals(ForcInterpolator.NEAREST, config.getInterpolation());
        assertEquals(ForcDistribution.EXTENSION_LINEAR, config.getExtension());
        assertThrows(UnsupportedOperationException.class,
                () -> new ForcConfig.Builder().interpolation("quintic"));
        assertThrows(UnsupportedOperationException.class,
                () -> new ForcConfig.Builder().extension("mirror"));
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void builder_validation() {
        assertThrows(IllegalArgumentException.class, () -> new ForcConfig.Builder().driftKernelSize(-1));
        assertThrows(IllegalArgumentException.class, () -> new ForcConfig.Builder().driftDensity(0));
        assertThrows(IllegalArgumentException.class, () -> new ForcConfig.Builder().smoothingFactor(0));
        assertThrows(IllegalArgumentException.class, () -> new ForcConfig.Builder().extensionFitPoints(0));
        assertThrows(IllegalArgumentException.class, () -> new ForcConfig.Builder().interpolation(3));
        assertThrows(IllegalArgumentException.class, () -> new ForcConfig.Builder().extension(-1));
    }

    @Test
    @DisplayName("Pipeline is copied and read-only")
    void pipeline_immutable() {
        List<ForcStage> stages = new ArrayList<ForcStage>();
        stages.add(ForcInterpolator::interpolate);
        ForcConfig config = new ForcConfig.Builder().pipeline(stages).build();
        stages.add(ForcNormalizer::normalize);

        assertEquals(1, config.getPipeline().size());
        assertThrows(UnsupportedOperationException.class,
                () -> config.getPipeline().add(ForcSlopeCorrector::correctSlope));
    }

    @Test
    @DisplayName("toBuilder keeps the values")
    void toBuilder_copies() {
        ForcConfig config = new ForcConfig.Builder().filePath("a.frc").step(0.25).hSat(1.5)
                .driftCorrection(false).smoothingFactor(5).build();

        ForcConfig copy = config.toBuilder().slope(0.1).build();

        assertEquals("a.frc", copy.getFilePath());
        assertEquals(0.25, copy.getStep(), 0);
        assertEquals(1.5, copy.getHSat(), 0);
        assertFalse(copy.isDriftCorrection());
        assertEquals(5, copy.getSmoothingFactor());
        assertEquals(0.1, copy.getSlope(), 0);
        assertTrue(Double.isNaN(config.getSlope()));
    }
}
