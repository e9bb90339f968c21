package org.janelia.dwiproc.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.dwiproc.client.stage.TractographyMethod;

/**
 * Parameters for tractography generation.
 */
public class TractographyParameters
        implements Serializable {

    @Parameter(
            names = "--tractographyMethod",
            description = "Seeding / tracking strategy (wm)")
    public String method = TractographyMethod.WM.getName();

    @Parameter(
            names = "--steps",
            description = "Step size (in mm) for tractography, omit to use kernel default")
    public Double steps;

    @Parameter(
            names = "--cutoff",
            description = "FOD amplitude cutoff for terminating streamlines, omit to use kernel default")
    public Double cutoff;

    @Parameter(
            names = "--streamlines",
            description = "Number of streamlines to select")
    public int streamlines = 10000;

    /**
     * @throws IllegalArgumentException
     *   if a numeric value is out of range.
     *
     * @throws org.janelia.dwiproc.client.stage.UnsupportedMethodException
     *   if the method name is not recognized.
     */
    public void validate()
            throws IllegalArgumentException {

        TractographyMethod.fromName(method);

        if ((steps != null) && (steps <= 0)) {
            throw new IllegalArgumentException("steps must be positive");
        }
        if ((cutoff != null) && (cutoff < 0)) {
            throw new IllegalArgumentException("cutoff must not be negative");
        }
        if (streamlines < 1) {
            throw new IllegalArgumentException("streamlines must be positive");
        }
    }
}
