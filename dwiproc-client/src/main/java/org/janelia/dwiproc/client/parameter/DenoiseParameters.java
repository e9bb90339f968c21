package org.janelia.dwiproc.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parameters for the denoising stage.
 */
public class DenoiseParameters
        implements Serializable {

    public static final List<String> ESTIMATORS = Arrays.asList("Exp1", "Exp2");

    @Parameter(
            names = "--denoiseSkip",
            description = "Skip denoising",
            arity = 0)
    public boolean skip = false;

    @Parameter(
            names = "--denoiseEstimator",
            description = "Noise level estimator (Exp1 or Exp2)")
    public String estimator = "Exp2";

    @Parameter(
            names = "--denoiseMap",
            description = "Generate and persist the estimated noise map",
            arity = 0)
    public boolean map = false;

    @Parameter(
            names = "--denoiseExtent",
            description = "Comma separated sliding window extent (one or three odd values, e.g. 5,5,5)")
    public List<Integer> extent;

    /**
     * @return extent formatted for the denoising kernel (e.g. "5,5,5"), or null if not specified.
     */
    public String getExtentArgument() {
        if ((extent == null) || extent.isEmpty()) {
            return null;
        }
        return extent.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    public void validate()
            throws IllegalArgumentException {

        if (! ESTIMATORS.contains(estimator)) {
            throw new IllegalArgumentException("denoiseEstimator '" + estimator + "' must be one of " + ESTIMATORS);
        }

        if (extent != null) {
            if ((extent.size() != 1) && (extent.size() != 3)) {
                throw new IllegalArgumentException("denoiseExtent must have one or three values");
            }
            for (final Integer size : extent) {
                if ((size == null) || (size < 1) || (size % 2 == 0)) {
                    throw new IllegalArgumentException("denoiseExtent values must be positive odd integers");
                }
            }
        }
    }
}
