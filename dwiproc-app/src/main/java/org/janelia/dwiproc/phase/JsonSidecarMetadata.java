package org.janelia.dwiproc.phase;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.dwiproc.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Acquisition metadata loaded from BIDS JSON sidecar files (one per acquisition),
 * with optional explicit overrides that take precedence over sidecar values.
 */
public class JsonSidecarMetadata
        implements AcquisitionMetadata {

    public static final String EFFECTIVE_ECHO_SPACING = "EffectiveEchoSpacing";
    public static final String ESTIMATED_EFFECTIVE_ECHO_SPACING = "EstimatedEffectiveEchoSpacing";
    public static final String PHASE_ENCODING_DIRECTION = "PhaseEncodingDirection";
    public static final String PHASE_ENCODING_AXIS = "PhaseEncodingAxis";

    private final List<Path> sidecars;
    private final Double echoSpacingOverride;
    private final List<String> directionOverrides;
    private final Map<Integer, JsonNode> indexToSidecar;

    /**
     * @param  sidecars            sidecar path for each acquisition (entries may be null).
     * @param  echoSpacingOverride echo spacing to use for every acquisition, or null to use sidecars.
     * @param  directionOverrides  direction label for each acquisition, or null/empty to use sidecars.
     */
    public JsonSidecarMetadata(final List<Path> sidecars,
                               final Double echoSpacingOverride,
                               final List<String> directionOverrides) {
        this.sidecars = sidecars == null ? Collections.emptyList() : new ArrayList<>(sidecars);
        this.echoSpacingOverride = echoSpacingOverride;
        this.directionOverrides = directionOverrides == null ?
                                  Collections.emptyList() : new ArrayList<>(directionOverrides);
        this.indexToSidecar = new HashMap<>();
    }

    @Override
    public double getEffectiveEchoSpacing(final int acquisitionIndex)
            throws MetadataMissingException {

        if (echoSpacingOverride != null) {
            return echoSpacingOverride;
        }

        final JsonNode sidecar = getSidecar(acquisitionIndex, EFFECTIVE_ECHO_SPACING);
        JsonNode value = sidecar.get(EFFECTIVE_ECHO_SPACING);
        if ((value == null) || (! value.isNumber())) {
            value = sidecar.get(ESTIMATED_EFFECTIVE_ECHO_SPACING);
        }
        if ((value == null) || (! value.isNumber())) {
            throw new MetadataMissingException(EFFECTIVE_ECHO_SPACING + " is missing from " +
                                               sidecars.get(acquisitionIndex));
        }

        return value.asDouble();
    }

    @Override
    public String getPhaseEncodingDirection(final int acquisitionIndex)
            throws MetadataMissingException {

        if (acquisitionIndex < directionOverrides.size()) {
            return directionOverrides.get(acquisitionIndex);
        }

        final JsonNode sidecar = getSidecar(acquisitionIndex, PHASE_ENCODING_DIRECTION);
        JsonNode value = sidecar.get(PHASE_ENCODING_DIRECTION);
        if ((value == null) || (! value.isTextual())) {
            value = sidecar.get(PHASE_ENCODING_AXIS);
            if ((value != null) && value.isTextual()) {
                LOG.warn("getPhaseEncodingDirection: {} is missing from {}, using {} '{}' (sign unknown)",
                         PHASE_ENCODING_DIRECTION, sidecars.get(acquisitionIndex), PHASE_ENCODING_AXIS,
                         value.asText());
            }
        }
        if ((value == null) || (! value.isTextual())) {
            throw new MetadataMissingException(PHASE_ENCODING_DIRECTION + " is missing from " +
                                               sidecars.get(acquisitionIndex));
        }

        return value.asText();
    }

    private JsonNode getSidecar(final int acquisitionIndex,
                                final String forKey)
            throws MetadataMissingException {

        JsonNode sidecar = indexToSidecar.get(acquisitionIndex);

        if (sidecar == null) {
            final Path path = acquisitionIndex < sidecars.size() ? sidecars.get(acquisitionIndex) : null;
            if (path == null) {
                throw new MetadataMissingException("no override or sidecar specified for " + forKey +
                                                   " of acquisition " + acquisitionIndex);
            }
            try {
                sidecar = JsonUtils.loadTree(path);
            } catch (final IOException e) {
                throw new MetadataMissingException("failed to load " + forKey + " for acquisition " +
                                                   acquisitionIndex, e);
            }
            indexToSidecar.put(acquisitionIndex, sidecar);
        }

        return sidecar;
    }

    private static final Logger LOG = LoggerFactory.getLogger(JsonSidecarMetadata.class);
}
