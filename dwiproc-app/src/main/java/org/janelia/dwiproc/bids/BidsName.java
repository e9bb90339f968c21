package org.janelia.dwiproc.bids;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Builds deterministic derivative file names and directories from entities plus a fixed,
 * ordered set of descriptor fields.
 *
 * <pre>
 *   sub-01_ses-A_run-1_space-T1w_res-dwi_method-iFOD2_algo-Exp2_param-noise_desc-preproc_meas-raw_dwi.nii.gz
 * </pre>
 *
 * Unset fields are omitted. Instances are immutable; each setter returns a modified copy
 * so a partially populated name can be shared by all outputs of a stage.
 */
public class BidsName {

    private final BidsEntities entities;
    private final String datatype;
    private final String space;
    private final String resolution;
    private final String model;
    private final String method;
    private final String algorithm;
    private final String parameter;
    private final String description;
    private final String measure;
    private final String suffix;
    private final String extension;

    public BidsName(final BidsEntities entities,
                    final String datatype) {
        this(entities, datatype, null, null, null, null, null, null, null, null, null, null);
    }

    private BidsName(final BidsEntities entities,
                     final String datatype,
                     final String space,
                     final String resolution,
                     final String model,
                     final String method,
                     final String algorithm,
                     final String parameter,
                     final String description,
                     final String measure,
                     final String suffix,
                     final String extension) {
        if (entities == null) {
            throw new IllegalArgumentException("entities must be specified");
        }
        this.entities = entities;
        this.datatype = datatype;
        this.space = space;
        this.resolution = resolution;
        this.model = model;
        this.method = method;
        this.algorithm = algorithm;
        this.parameter = parameter;
        this.description = description;
        this.measure = measure;
        this.suffix = suffix;
        this.extension = extension;
    }

    public BidsEntities getEntities() {
        return entities;
    }

    public String getDatatype() {
        return datatype;
    }

    public BidsName space(final String space) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName resolution(final String resolution) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName model(final String model) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName method(final String method) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName algorithm(final String algorithm) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName parameter(final String parameter) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName description(final String description) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName measure(final String measure) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    public BidsName suffix(final String suffix) {
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    /**
     * @param  extension  file extension including leading dot (e.g. ".nii.gz").
     */
    public BidsName extension(final String extension) {
        if ((extension != null) && (! extension.startsWith("."))) {
            throw new IllegalArgumentException("extension '" + extension + "' must start with '.'");
        }
        return new BidsName(entities, datatype, space, resolution, model, method, algorithm, parameter,
                            description, measure, suffix, extension);
    }

    /**
     * @return file name built from the populated entities and descriptor fields.
     *
     * @throws IllegalStateException
     *   if no suffix has been specified.
     */
    public String toFileName() {

        if (suffix == null) {
            throw new IllegalStateException("suffix must be specified to build a file name for " + entities);
        }

        final StringBuilder sb = new StringBuilder();
        for (final Map.Entry<String, String> entry : entities.asMap().entrySet()) {
            appendPair(sb, entry.getKey(), entry.getValue());
        }
        appendPair(sb, "space", space);
        appendPair(sb, "res", resolution);
        appendPair(sb, "model", model);
        appendPair(sb, "method", method);
        appendPair(sb, "algo", algorithm);
        appendPair(sb, "param", parameter);
        appendPair(sb, "desc", description);
        appendPair(sb, "meas", measure);

        sb.append('_').append(suffix);
        if (extension != null) {
            sb.append(extension);
        }

        return sb.toString();
    }

    /**
     * @return relative directory for these entities (e.g. sub-01/ses-A/dwi) without any file name.
     */
    public Path toDirectory() {
        Path directory = Paths.get("sub-" + entities.getSubject());
        if (entities.getSession() != null) {
            directory = directory.resolve("ses-" + entities.getSession());
        }
        if (datatype != null) {
            directory = directory.resolve(datatype);
        }
        return directory;
    }

    /**
     * @return relative directory plus file name.
     */
    public Path toRelativePath() {
        return toDirectory().resolve(toFileName());
    }

    @Override
    public String toString() {
        return suffix == null ? toDirectory().toString() : toFileName();
    }

    private static void appendPair(final StringBuilder sb,
                                   final String key,
                                   final String value) {
        if (value != null) {
            if (sb.length() > 0) {
                sb.append('_');
            }
            sb.append(key).append('-').append(value);
        }
    }

}
