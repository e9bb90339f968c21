package org.janelia.dwiproc.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.List;

import org.janelia.dwiproc.phase.PhaseEncodingDirection;

/**
 * Explicit acquisition metadata that overrides values in JSON sidecar files.
 */
public class MetadataParameters
        implements Serializable {

    @Parameter(
            names = "--echoSpacing",
            description = "Effective echo spacing (seconds) for all acquisitions")
    public Double echoSpacing;

    @Parameter(
            names = "--peDirection",
            description = "Phase encoding direction (i, j, k, i-, j-, k-) for each acquisition in order",
            variableArity = true)
    public List<String> peDirections;

    public void validate()
            throws IllegalArgumentException {
        if ((echoSpacing != null) && (echoSpacing <= 0)) {
            throw new IllegalArgumentException("echoSpacing must be positive");
        }
        if (peDirections != null) {
            for (final String label : peDirections) {
                PhaseEncodingDirection.fromLabel(label);
            }
        }
    }
}
