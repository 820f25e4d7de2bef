package org.scharp.csv2netcdf;

import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Records when and how a dataset was created.
 * <p>
 * Every dataset gets a {@code date_created} attribute, the UTC calendar date of the conversion. With
 * {@link MetadataProfile#CF}, it also gets a {@code history} attribute of the form
 * </p>
 * <pre>
 * 2024-05-01T12:30:00Z alice csv2netcdf: /data/in/station.csv -&gt; /data/out/station.nc
 * </pre>
 * <p>
 * The history is for people.  Nothing parses it, so its format may change.
 * </p>
 */
public final class ProvenanceRecorder {

    static final String DATE_CREATED = "date_created";
    static final String HISTORY = "history";

    private final MetadataProfile profile;

    /**
     * Creates a recorder.
     *
     * @param profile
     *     The profile that decides whether a history is recorded.
     *
     * @throws NullPointerException
     *     if {@code profile} is {@code null}.
     */
    public ProvenanceRecorder(MetadataProfile profile) {
        ArgumentUtil.checkNotNull(profile, "profile");
        this.profile = profile;
    }

    /**
     * Records the provenance of a dataset.
     *
     * @param dataset
     *     The dataset.
     * @param provenance
     *     Who converted it, when, and with what.
     * @param source
     *     The file from which the dataset was read.
     * @param target
     *     The file to which the dataset will be written.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     */
    public void record(Dataset dataset, Provenance provenance, Path source, Path target) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(provenance, "provenance");
        ArgumentUtil.checkNotNull(source, "source");
        ArgumentUtil.checkNotNull(target, "target");

        dataset.setAttribute(DATE_CREATED, dateCreated(provenance));
        if (profile.recordsHistory()) {
            dataset.setAttribute(HISTORY, history(provenance, source, target));
        }
    }

    static String dateCreated(Provenance provenance) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(provenance.conversionTime().atOffset(ZoneOffset.UTC));
    }

    static String history(Provenance provenance, Path source, Path target) {
        return provenance.conversionTime().truncatedTo(ChronoUnit.SECONDS) + " " +
            provenance.user() + " " +
            provenance.converterName() + ": " +
            source + " -> " + target;
    }
}
