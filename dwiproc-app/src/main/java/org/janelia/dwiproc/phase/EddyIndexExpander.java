package org.janelia.dwiproc.phase;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.nifti.NiftiHeader;
import org.janelia.dwiproc.scratch.ScratchAllocator;
import org.janelia.dwiproc.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands per-acquisition group indices into the per-volume index table consumed by eddy.
 */
public class EddyIndexExpander {

    public static final String LABEL = "eddy-indices";

    private EddyIndexExpander() {
    }

    /**
     * @param  headers  header of each acquisition in acquisition order.
     * @param  indices  group index for each acquisition, or null to use "1" for all.
     *
     * @return one index per frame (images with fewer than four dimensions contribute one entry).
     *
     * @throws IllegalArgumentException
     *   if an index list is provided whose size differs from the number of headers.
     */
    public static List<String> expand(final List<NiftiHeader> headers,
                                      final List<String> indices)
            throws IllegalArgumentException {

        if ((indices != null) && (indices.size() != headers.size())) {
            throw new IllegalArgumentException(
                    indices.size() + " group indices " + indices + " were provided for " + headers.size() +
                    " acquisitions, every acquisition must be assigned a group index");
        }

        final List<String> expanded = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            final NiftiHeader header = headers.get(i);
            final String index = indices == null ? "1" : indices.get(i);
            final int count = header.getNumberOfDimensions() < 4 ? 1 : header.getNumberOfFrames();
            for (int frame = 0; frame < count; frame++) {
                expanded.add(index);
            }
        }

        return expanded;
    }

    /**
     * Expands indices for the specified volumes and writes them as a single space delimited line
     * to a desc-eddy_indices.txt artifact.
     *
     * @return path of the written index file.
     */
    public static Path writeIndexFile(final List<Path> volumes,
                                      final List<String> indices,
                                      final BidsEntities entities,
                                      final ScratchAllocator scratchAllocator)
            throws IOException, IllegalArgumentException {

        final List<NiftiHeader> headers = new ArrayList<>(volumes.size());
        for (final Path volume : volumes) {
            headers.add(NiftiHeader.read(volume));
        }

        final List<String> expanded = expand(headers, indices);

        final BidsName name = new BidsName(entities, "dwi")
                .description("eddy")
                .suffix("indices")
                .extension(".txt");
        final Path path = scratchAllocator.allocateFile(LABEL, name);

        try (final Writer writer = FileUtil.DEFAULT_INSTANCE.getExtensionBasedWriter(path.toString())) {
            writer.write(String.join(" ", expanded));
            writer.write('\n');
        }

        LOG.info("writeIndexFile: wrote {} indices for {} volumes to {}", expanded.size(), volumes.size(), path);

        return path;
    }

    private static final Logger LOG = LoggerFactory.getLogger(EddyIndexExpander.class);
}
