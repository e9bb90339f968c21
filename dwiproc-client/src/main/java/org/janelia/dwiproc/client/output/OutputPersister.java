package org.janelia.dwiproc.client.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.bids.BidsRelativePath;
import org.janelia.dwiproc.bids.UnresolvedPathException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies artifacts from the working tree into the final output tree.
 *
 * The location below the target directory mirrors the artifact's subject relative path,
 * which starts at its first "sub-" component.
 */
public class OutputPersister {

    private final Path outputRoot;

    public OutputPersister(final Path outputRoot) {
        this.outputRoot = outputRoot.toAbsolutePath();
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    /**
     * @return output directory for the entities and datatype of the specified name
     *         (e.g. [outputRoot]/sub-01/ses-A/dwi).
     */
    public Path getOutputDirectory(final BidsName name) {
        return outputRoot.resolve(name.toDirectory().toString());
    }

    /**
     * Copies the artifact (preserving its modification time) to the directory.
     *
     * @return path of the persisted copy.
     *
     * @throws UnresolvedPathException
     *   if the artifact path does not contain a subject component.
     *
     * @throws IOException
     *   if the copy fails.
     */
    public static Path save(final Path artifact,
                            final Path outputDirectory)
            throws UnresolvedPathException, IOException {

        final BidsRelativePath relativePath = BidsRelativePath.of(artifact);
        final Path target = relativePath.resolveAgainst(outputDirectory);

        FileUtils.copyFile(artifact.toFile(), target.toFile(), true);

        LOG.info("save: copied {} to {}", artifact, target);

        return target;
    }

    /**
     * Saves each artifact in order, stopping at the first failure.
     *
     * @return paths of the persisted copies.
     */
    public static List<Path> save(final List<Path> artifacts,
                                  final Path outputDirectory)
            throws UnresolvedPathException, IOException {
        final List<Path> targets = new ArrayList<>(artifacts.size());
        for (final Path artifact : artifacts) {
            targets.add(save(artifact, outputDirectory));
        }
        return targets;
    }

    private static final Logger LOG = LoggerFactory.getLogger(OutputPersister.class);
}
