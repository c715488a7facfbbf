import ij.IJ;
import java.io.IOException;

/**
 *  Entry point for FORC analysis: Ingests a FORC data file and runs the
 *  processing stages of the configuration on it, keeping the current state
 *  of the data. Further stages can be applied later, e.g.
 *  <pre>
 *  Forc forc = new Forc(config);       //reads, corrects drift, interpolates
 *  forc.apply(ForcSlopeCorrector::correctSlope);
 *  forc.computeDistribution();
 *  double[][] rho = forc.getData().getRho();
 *  </pre>
 *  Each stage creates a new ForcData snapshot; earlier snapshots remain valid.
 *  The static 'run' method does the processing without a Forc object.
 */

/** This code is part of the FORCj package for FORC analysis.
 *  Licensed under GNU General Public License v3.0 or later (GPL-3.0-or-later),
 *  https://www.gnu.org/licenses/gpl-3.0.html
 */

public class Forc {
    private final ForcConfig config;
    private ForcData data;

    /** Reads the file given in the configuration and processes it with the
     *  pipeline of the configuration.
     *  @throws IOException if the file cannot be read or has an invalid format */
    public Forc(ForcConfig config) throws IOException {
        this(ForcIngester.ingest(config.getFilePath()), config);
    }

    /** Processes the given data with the pipeline of the configuration */
    public Forc(ForcData data, ForcConfig config) {
        this.config = config;
        this.data = run(data, config);
    }

    /** Applies the stages of the configuration's pipeline, in sequence, and
     *  returns the final result. There is no error recovery; any exception
     *  thrown by a stage aborts the processing. */
    public static ForcData run(ForcData data, ForcConfig config) {
        for (ForcStage stage : config.getPipeline()) {
            data = stage.apply(data, config);
            if (data == null)
                throw new IllegalStateException("Processing stage returned no data: "+stage);
        }
        return data;
    }

    /** Returns the current data */
    public ForcData getData() {
        return data;
    }

    /** Returns the configuration */
    public ForcConfig getConfig() {
        return config;
    }

    /** Applies a further processing stage to the current data and returns the result,
     *  which also becomes the current data */
    public ForcData apply(ForcStage stage) {
        data = stage.apply(data, config);
        return data;
    }

    /** Computes the FORC distribution, after extending the grid as specified
     *  in the configuration. If the current data already have a FORC distribution,
     *  the grid is not extended again. Returns the new current data. */
    public ForcData computeDistribution() {
        if (!data.hasRho())
            data = ForcDistribution.extend(data, config);
        else if (IJ.debugMode)
            IJ.log("FORC distribution exists already, no extension");
        data = ForcDistribution.computeDistribution(data, config);
        return data;
    }
}
