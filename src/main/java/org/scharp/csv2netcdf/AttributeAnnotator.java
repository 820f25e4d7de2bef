///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.nio.file.Path;

/**
 * Attaches the descriptive attributes of a {@link MetadataProfile} to a dataset.
 * <p>
 * Every variable, including the time coordinate, gets a {@code units} attribute.  With {@link MetadataProfile#CF},
 * every variable also gets a {@code standard_name} and a {@code long_name}.  The dataset gets a {@code title} and,
 * with {@link MetadataProfile#UNITS_ONLY}, a {@code featureType}.
 * </p>
 */
public final class AttributeAnnotator {

    static final String UNITS = "units";
    static final String STANDARD_NAME = "standard_name";
    static final String LONG_NAME = "long_name";
    static final String TITLE = "title";
    static final String FEATURE_TYPE = "featureType";

    /** The CF feature type of a single station's observations */
    static final String TIME_SERIES = "timeSeries";

    private final MetadataProfile profile;

    /**
     * Creates an annotator.
     *
     * @param profile
     *     The metadata to attach.
     *
     * @throws NullPointerException
     *     if {@code profile} is {@code null}.
     */
    public AttributeAnnotator(MetadataProfile profile) {
        ArgumentUtil.checkNotNull(profile, "profile");
        this.profile = profile;
    }

    /**
     * Annotates a dataset.
     *
     * @param dataset
     *     The dataset to annotate.
     * @param source
     *     The file from which the dataset was read.  Its base name becomes the title.
     *
     * @throws NullPointerException
     *     if {@code dataset} or {@code source} is {@code null}.
     * @throws VocabularyLookupException
     *     if a variable has no entry in the profile's vocabulary.
     */
    public void annotate(Dataset dataset, Path source) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(source, "source");

        // Look everything up before changing the dataset, so that a missing entry leaves it untouched.
        for (Variable variable : dataset.variables()) {
            profile.unitsOf(variable.name());
            if (profile.namesVariables()) {
                profile.standardNameOf(variable.name());
            }
        }

        for (Variable variable : dataset.variables()) {
            variable.setAttribute(UNITS, profile.unitsOf(variable.name()));
            if (profile.namesVariables()) {
                variable.setAttribute(STANDARD_NAME, profile.standardNameOf(variable.name()));
                variable.setAttribute(LONG_NAME, variable.name());
            }
        }

        if (profile.tagsFeatureType()) {
            dataset.setAttribute(FEATURE_TYPE, TIME_SERIES);
        }
        dataset.setAttribute(TITLE, FileNames.baseName(source));
    }
}
