package org.janelia.dwiproc.phase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns eddy correction group indices to the acquisitions of a subject's phase encoding set.
 *
 * When every acquisition has the same direction they all share group "1".  Otherwise
 * left-right (i axis) acquisitions are preferred: if there are exactly two of them their
 * 1-based positions are returned, else the positions of the anterior-posterior (j axis)
 * acquisitions are returned.  Sets with neither (e.g. k and k-) are not grouped.
 */
public class PhaseEncodingIndexGrouper {

    private PhaseEncodingIndexGrouper() {
    }

    /**
     * @param  directionLabels  direction label of each acquisition in acquisition order.
     *
     * @return group index strings, or an empty list if the directions could not be grouped.
     *         The list only has one entry per acquisition when all directions are identical
     *         or every acquisition is on the selected axis, so callers must check its size
     *         against the acquisition count.
     */
    public static List<String> group(final List<String> directionLabels) {

        if (new HashSet<>(directionLabels).size() <= 1) {
            return new ArrayList<>(Collections.nCopies(directionLabels.size(), "1"));
        }

        final List<String> leftRight = new ArrayList<>();
        final List<String> anteriorPosterior = new ArrayList<>();
        for (int i = 0; i < directionLabels.size(); i++) {
            final String label = directionLabels.get(i);
            final char axis = label.isEmpty() ? ' ' : label.charAt(0);
            if (axis == 'i') {
                leftRight.add(String.valueOf(i + 1));
            } else if (axis == 'j') {
                anteriorPosterior.add(String.valueOf(i + 1));
            }
        }

        final List<String> indices = leftRight.size() == 2 ? leftRight : anteriorPosterior;

        if (indices.isEmpty()) {
            LOG.info("group: no LR pair or AP acquisitions in directions {}, leaving them ungrouped",
                     directionLabels);
            return indices;
        }

        LOG.info("group: using {} indices {} for directions {}",
                 indices == leftRight ? "LR" : "AP", indices, directionLabels);

        return indices;
    }

    private static final Logger LOG = LoggerFactory.getLogger(PhaseEncodingIndexGrouper.class);
}
