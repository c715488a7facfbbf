import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *  Parameters for ingesting and processing FORC data.
 *  A ForcConfig is immutable; create it with a ForcConfig.Builder, e.g.
 *  <pre>
 *  ForcConfig config = new ForcConfig.Builder()
 *      .filePath("sample.frc")
 *      .interpolation(ForcInterpolator.LINEAR)
 *      .smoothingFactor(4)
 *      .build();
 *  </pre>
 *  Unless specified, the pipeline run after ingestion is the default one,
 *  drift correction (if enabled) followed by interpolation onto a grid.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class ForcConfig {
    private final String filePath;
    private final double step;
    private final int interpolation;
    private final boolean driftCorrection;
    private final int driftKernelSize;
    private final int driftDensity;
    private final double hSat;
    private final double slope;
    private final int smoothingFactor;
    private final int extension;
    private final int extensionFitPoints;
    private final List<ForcStage> pipeline;

    private ForcConfig(Builder b) {
        filePath = b.filePath;
        step = b.step;
        interpolation = b.interpolation;
        driftCorrection = b.driftCorrection;
        driftKernelSize = b.driftKernelSize;
        driftDensity = b.driftDensity;
        hSat = b.hSat;
        slope = b.slope;
        smoothingFactor = b.smoothingFactor;
        extension = b.extension;
        extensionFitPoints = b.extensionFitPoints;
        pipeline = b.pipeline == null ? null :
                Collections.unmodifiableList(new ArrayList<ForcStage>(b.pipeline));
    }

    /** Returns a configuration with all default values and no file path */
    public static ForcConfig defaults() {
        return new Builder().build();
    }

    /** Path of the file with the raw data, may be null */
    public String getFilePath()         { return filePath; }
    /** Grid step; NaN or non-positive means the median step of the raw data */
    public double getStep()             { return step; }
    /** Interpolation method, ForcInterpolator.NEAREST, LINEAR or CUBIC */
    public int getInterpolation()       { return interpolation; }
    /** Whether the default pipeline includes drift correction */
    public boolean isDriftCorrection()  { return driftCorrection; }
    /** Half width k of the moving average of the drift values (window 2k+1) */
    public int getDriftKernelSize()     { return driftKernelSize; }
    /** Decimation stride of the averaged drift values for the spline */
    public int getDriftDensity()        { return driftDensity; }
    /** Saturation field for slope correction; only |H| > hSat is fitted */
    public double getHSat()             { return hSat; }
    /** Manual background slope; NaN means that the slope is fitted */
    public double getSlope()            { return slope; }
    /** Half width of the FORC distribution kernel, in grid steps */
    public int getSmoothingFactor()     { return smoothingFactor; }
    /** Extension at the low-H side, ForcDistribution.EXTENSION_NONE, _FLAT or _LINEAR */
    public int getExtension()           { return extension; }
    /** Number of finite points per row for the linear extension */
    public int getExtensionFitPoints()  { return extensionFitPoints; }

    /** Returns the stages to run on the ingested data, in this sequence */
    public List<ForcStage> getPipeline() {
        return pipeline != null ? pipeline : defaultPipeline();
    }

    /** Returns the default pipeline: Drift correction (if enabled), then interpolation */
    public List<ForcStage> defaultPipeline() {
        List<ForcStage> stages = new ArrayList<ForcStage>();
        if (driftCorrection)
            stages.add(ForcDriftCorrector::correctDrift);
        stages.add(ForcInterpolator::interpolate);
        return Collections.unmodifiableList(stages);
    }

    /** Returns a builder initialized with the values of this configuration */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.filePath = filePath;
        b.step = step;
        b.interpolation = interpolation;
        b.driftCorrection = driftCorrection;
        b.driftKernelSize = driftKernelSize;
        b.driftDensity = driftDensity;
        b.hSat = hSat;
        b.slope = slope;
        b.smoothingFactor = smoothingFactor;
        b.extension = extension;
        b.extensionFitPoints = extensionFitPoints;
        b.pipeline = pipeline;
        return b;
    }

    /** String representation */
    public String toString() {
        return "ForcConfig[file="+filePath+", step="+(float)step+
                ", interpolation="+ForcInterpolator.METHOD_NAMES[interpolation]+
                ", drift="+driftCorrection+" (k="+driftKernelSize+", density="+driftDensity+")"+
                ", hSat="+(float)hSat+", slope="+(float)slope+", sf="+smoothingFactor+
                ", extension="+ForcDistribution.EXTENSION_NAMES[extension]+
                (pipeline == null ? "" : ", "+pipeline.size()+" stages")+"]";
    }

    /** Builder for ForcConfig objects; the setters check the values and
     *  throw an IllegalArgumentException for invalid ones. */
    public static class Builder {
        private String filePath = null;
        private double step = Double.NaN;
        private int interpolation = ForcInterpolator.CUBIC;
        private boolean driftCorrection = true;
        private int driftKernelSize = 4;
        private int driftDensity = 3;
        private double hSat = 0;
        private double slope = Double.NaN;
        private int smoothingFactor = 3;
        private int extension = ForcDistribution.EXTENSION_NONE;
        private int extensionFitPoints = 5;
        private List<ForcStage> pipeline = null;

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder step(double step) {
            this.step = step;
            return this;
        }

        /** Sets the interpolation method, ForcInterpolator.NEAREST, LINEAR or CUBIC */
        public Builder interpolation(int method) {
            if (method < 0 || method >= ForcInterpolator.METHOD_NAMES.length)
                throw new IllegalArgumentException("Invalid interpolation method: "+method);
            this.interpolation = method;
            return this;
        }

        /** Sets the interpolation method by name: 'nearest', 'linear' or 'cubic'
         *  @throws UnsupportedOperationException for other names */
        public Builder interpolation(String name) {
            this.interpolation = ForcInterpolator.getMethod(name);
            return this;
        }

        public Builder driftCorrection(boolean driftCorrection) {
            this.driftCorrection = driftCorrection;
            return this;
        }

        public Builder driftKernelSize(int driftKernelSize) {
            if (driftKernelSize < 0)
                throw new IllegalArgumentException("Drift kernel size must not be negative: "+driftKernelSize);
            this.driftKernelSize = driftKernelSize;
            return this;
        }

        public Builder driftDensity(int driftDensity) {
            if (driftDensity < 1)
                throw new IllegalArgumentException("Drift density must be 1 or more: "+driftDensity);
            this.driftDensity = driftDensity;
            return this;
        }

        public Builder hSat(double hSat) {
            this.hSat = hSat;
            return this;
        }

        /** Sets a fixed background slope; NaN for fitting the slope */
        public Builder slope(double slope) {
            this.slope = slope;
            return this;
        }

        public Builder smoothingFactor(int smoothingFactor) {
            if (smoothingFactor < 1)
                throw new IllegalArgumentException("Smoothing factor must be 1 or more: "+smoothingFactor);
            this.smoothingFactor = smoothingFactor;
            return this;
        }

        /** Sets the extension type, ForcDistribution.EXTENSION_NONE, _FLAT or _LINEAR */
        public Builder extension(int extension) {
            if (extension < 0 || extension >= ForcDistribution.EXTENSION_NAMES.length)
                throw new IllegalArgumentException("Invalid extension type: "+extension);
            this.extension = extension;
            return this;
        }

        /** Sets the extension type by name: 'none', 'flat' or 'linear'
         *  @throws UnsupportedOperationException for other names */
        public Builder extension(String name) {
            this.extension = ForcDistribution.getExtensionType(name);
            return this;
        }

        public Builder extensionFitPoints(int extensionFitPoints) {
            if (extensionFitPoints < 1)
                throw new IllegalArgumentException("Number of fit points for extension must be 1 or more: "+extensionFitPoints);
            this.extensionFitPoints = extensionFitPoints;
            return this;
        }

        /** Sets the stages to run after ingestion; null for the default pipeline */
        public Builder pipeline(List<ForcStage> pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public ForcConfig build() {
            return new ForcConfig(this);
        }
    }
}
