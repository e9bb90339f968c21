package org.janelia.dwiproc.bids;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subject relative portion of a working or input path, together with the entities
 * encoded in its leading component.
 *
 * The relative portion starts at the first path component that begins with the subject
 * marker "sub-" (a subject directory or an entity prefixed file name) and runs to the end
 * of the path.
 */
public class BidsRelativePath {

    public static final String SUBJECT_MARKER = BidsEntities.SUBJECT + "-";

    private final Path relativePath;
    private final Map<String, String> entities;

    private BidsRelativePath(final Path relativePath,
                             final Map<String, String> entities) {
        this.relativePath = relativePath;
        this.entities = entities;
    }

    /**
     * @param  path  absolute or relative path to an input or artifact.
     *
     * @return structured relative path for the specified path.
     *
     * @throws UnresolvedPathException
     *   if no component of the path starts with the subject marker.
     */
    public static BidsRelativePath of(final Path path)
            throws UnresolvedPathException {

        final Path normalized = path.normalize();
        for (int i = 0; i < normalized.getNameCount(); i++) {
            final String component = normalized.getName(i).toString();
            if (component.startsWith(SUBJECT_MARKER)) {
                final Path relative = normalized.subpath(i, normalized.getNameCount());
                return new BidsRelativePath(relative, parseEntities(relative));
            }
        }

        throw new UnresolvedPathException(path);
    }

    public Path getRelativePath() {
        return relativePath;
    }

    /**
     * @return entity key-value pairs found in the relative path's components, in path order
     *         (later components never override earlier ones).
     */
    public Map<String, String> getEntities() {
        return entities;
    }

    public String getSubject() {
        return entities.get(BidsEntities.SUBJECT);
    }

    /**
     * @return location of this path under the specified root directory.
     */
    public Path resolveAgainst(final Path rootDirectory) {
        return rootDirectory.resolve(relativePath.toString());
    }

    @Override
    public String toString() {
        return relativePath.toString();
    }

    private static Map<String, String> parseEntities(final Path relative) {
        final Map<String, String> entities = new LinkedHashMap<>();
        for (final Path component : relative) {
            for (final String pair : component.toString().split("_")) {
                final int dash = pair.indexOf('-');
                if (dash > 0) {
                    final String key = pair.substring(0, dash);
                    if (BidsEntities.KEY_ORDER.contains(key)) {
                        String value = pair.substring(dash + 1);
                        final int dot = value.indexOf('.');
                        if (dot > -1) {
                            value = value.substring(0, dot);
                        }
                        entities.putIfAbsent(key, value);
                    }
                }
            }
        }
        return entities;
    }

}
