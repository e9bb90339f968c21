package org.janelia.dwiproc.client.stage;

import java.nio.file.Path;

/**
 * Artifacts produced by the tractography stage.
 */
public class TractographyOutputs {

    private final Path tracks;
    private final Path weights;
    private final Path rawDensity;
    private final Path weightedDensity;

    public TractographyOutputs(final Path tracks,
                               final Path weights,
                               final Path rawDensity,
                               final Path weightedDensity) {
        this.tracks = tracks;
        this.weights = weights;
        this.rawDensity = rawDensity;
        this.weightedDensity = weightedDensity;
    }

    public Path getTracks() {
        return tracks;
    }

    /** @return per-streamline SIFT2 weights. */
    public Path getWeights() {
        return weights;
    }

    /** @return unweighted track density image (computed, not persisted). */
    public Path getRawDensity() {
        return rawDensity;
    }

    public Path getWeightedDensity() {
        return weightedDensity;
    }

    @Override
    public String toString() {
        return "{tracks: " + tracks + ", weights: " + weights + ", rawDensity: " + rawDensity +
               ", weightedDensity: " + weightedDensity + "}";
    }
}
