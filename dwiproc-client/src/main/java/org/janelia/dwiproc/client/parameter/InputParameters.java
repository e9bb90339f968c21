package org.janelia.dwiproc.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.json.JsonUtils;
import org.janelia.dwiproc.spec.InputGroup;
import org.janelia.dwiproc.util.FileUtil;

/**
 * Resolved input files for one subject.  Each list option holds one entry per acquisition
 * (in acquisition order).
 */
public class InputParameters
        implements Serializable {

    @Parameter(
            names = "--subject",
            description = "Subject label (without 'sub-')")
    public String subject;

    @Parameter(
            names = "--session",
            description = "Session label (without 'ses-')")
    public String session;

    @Parameter(
            names = "--run",
            description = "Run label, when omitted acquisitions are numbered 1-n if there is more than one")
    public String run;

    @Parameter(
            names = "--dwi",
            description = "Diffusion weighted volume for each acquisition",
            variableArity = true)
    public List<String> dwi = new ArrayList<>();

    @Parameter(
            names = "--bval",
            description = "b-value file for each acquisition",
            variableArity = true)
    public List<String> bval = new ArrayList<>();

    @Parameter(
            names = "--bvec",
            description = "b-vector file for each acquisition",
            variableArity = true)
    public List<String> bvec = new ArrayList<>();

    @Parameter(
            names = "--dwiJson",
            description = "JSON sidecar for each acquisition",
            variableArity = true)
    public List<String> dwiJson = new ArrayList<>();

    @Parameter(
            names = "--mask",
            description = "Brain mask")
    public String mask;

    @Parameter(
            names = "--t1w",
            description = "Anatomical reference volume")
    public String t1w;

    @Parameter(
            names = "--transform",
            description = "4x4 dwi to T1w transform used to rotate b-vectors of the first acquisition")
    public String transform;

    @Parameter(
            names = "--b0",
            description = "4D b=0 volume to intensity normalize")
    public String b0;

    @Parameter(
            names = "--wmFod",
            description = "White matter FOD volume, tractography is skipped when omitted")
    public String wmFod;

    /**
     * @return parameters loaded from a JSON index file with the same field names as these parameters.
     */
    public static InputParameters fromIndex(final Path indexPath)
            throws IOException {
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(indexPath.toString())) {
            return JsonUtils.MAPPER.readValue(reader, InputParameters.class);
        } catch (final IOException e) {
            throw new IOException("failed to load inputs from " + indexPath, e);
        }
    }

    public int getAcquisitionCount() {
        return dwi == null ? 0 : dwi.size();
    }

    public BidsEntities getEntities() {
        return new BidsEntities.Builder().subject(subject).session(session).run(run).build();
    }

    /**
     * @return one input group per acquisition.
     */
    public List<InputGroup> buildInputGroups() {
        final BidsEntities entities = getEntities();
        final int count = getAcquisitionCount();
        final List<InputGroup> groups = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final BidsEntities acquisitionEntities =
                    ((count > 1) && (run == null)) ? entities.with(BidsEntities.RUN, i + 1) : entities;
            groups.add(new InputGroup.Builder()
                               .entities(acquisitionEntities)
                               .dwi(Paths.get(dwi.get(i)))
                               .bval(Paths.get(bval.get(i)))
                               .bvec(Paths.get(bvec.get(i)))
                               .dwiSidecar(toPath(dwiJson, i))
                               .mask(mask == null ? null : Paths.get(mask))
                               .t1w(t1w == null ? null : Paths.get(t1w))
                               .build());
        }
        return groups;
    }

    public Path getTransform() {
        return transform == null ? null : Paths.get(transform);
    }

    public Path getB0() {
        return b0 == null ? null : Paths.get(b0);
    }

    public Path getWmFod() {
        return wmFod == null ? null : Paths.get(wmFod);
    }

    public void validate()
            throws IllegalArgumentException {

        if ((subject == null) || subject.trim().isEmpty()) {
            throw new IllegalArgumentException("subject must be specified");
        }

        final int count = getAcquisitionCount();
        if (count == 0) {
            throw new IllegalArgumentException("at least one dwi volume must be specified");
        }
        if ((bval == null) || (bval.size() != count) || (bvec == null) || (bvec.size() != count)) {
            throw new IllegalArgumentException("one bval and one bvec file must be specified for each of the " +
                                               count + " dwi volumes");
        }
        if ((dwiJson != null) && (! dwiJson.isEmpty()) && (dwiJson.size() != count)) {
            throw new IllegalArgumentException("when specified, one dwiJson file must be specified for each of the " +
                                               count + " dwi volumes");
        }

        // fail early on invalid entity values
        getEntities();
    }

    private static Path toPath(final List<String> values,
                               final int index) {
        return ((values == null) || (index >= values.size())) ? null : Paths.get(values.get(index));
    }
}
