///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The settings of a conversion run.
 * <p>
 * Instances of this class are immutable.  They are usually read from a YAML file by {@link ConfigLoader}, but can be
 * created with a {@link ConverterConfig.Builder}:
 * </p>
 *
 * <pre>
 * ConverterConfig config = ConverterConfig.builder().
 *     inputPaths(List.of(Path.of("in/station-1.csv"), Path.of("in/station-2.csv"))).
 *     outputDirectory(Path.of("out")).
 *     globalAttributes(Map.of("institution", "Marine Observatory")).
 *     metadataProfile(MetadataProfile.CF).
 *     build();
 * </pre>
 */
public final class ConverterConfig {
    private final List<Path> inputPaths;
    private final Path outputDirectory;
    private final Map<String, Object> globalAttributes;
    private final MetadataProfile metadataProfile;
    private final NumericPolicy numericPolicy;
    private final FailurePolicy failurePolicy;

    /**
     * A builder class for {@link ConverterConfig}.
     */
    public final static class Builder {
        private List<Path> inputPaths;
        private Path outputDirectory;
        private Map<String, Object> globalAttributes;
        private MetadataProfile metadataProfile;
        private NumericPolicy numericPolicy;
        private FailurePolicy failurePolicy;

        /**
         * Creates a {@code ConverterConfig} builder with no global attributes, the units-only metadata profile, the
         * all-float numeric policy, and the abort failure policy.
         */
        private Builder() {
            this.inputPaths = List.of(); // required parameter
            this.outputDirectory = null; // required parameter
            this.globalAttributes = Map.of();
            this.metadataProfile = MetadataProfile.UNITS_ONLY;
            this.numericPolicy = NumericPolicy.ALL_FLOAT;
            this.failurePolicy = FailurePolicy.ABORT;
        }

        /**
         * Sets the files to convert.
         *
         * @param inputPaths
         *     The files, in the order in which they should be converted. This list is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code inputPaths} is {@code null} or contains a {@code null} entry.
         * @throws IllegalArgumentException
         *     if {@code inputPaths} is empty.
         */
        public Builder inputPaths(List<Path> inputPaths) {
            ArgumentUtil.checkNotNull(inputPaths, "inputPaths");
            if (inputPaths.isEmpty()) {
                throw new IllegalArgumentException("inputPaths must not be empty");
            }
            for (Path inputPath : inputPaths) {
                if (inputPath == null) {
                    throw new NullPointerException("inputPaths cannot contain a null entry");
                }
            }
            this.inputPaths = List.copyOf(inputPaths);
            return this;
        }

        /**
         * Sets the directory into which NetCDF files are written.
         *
         * @param outputDirectory
         *     The directory.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code outputDirectory} is {@code null}.
         */
        public Builder outputDirectory(Path outputDirectory) {
            ArgumentUtil.checkNotNull(outputDirectory, "outputDirectory");
            this.outputDirectory = outputDirectory;
            return this;
        }

        /**
         * Sets the global attributes that are added to every dataset.
         *
         * @param globalAttributes
         *     The attributes, in the order in which they should be applied.  Values may be strings, numbers, booleans,
         *     or empty (see {@link ConfiguredAttributeMerger}).  The map is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code globalAttributes} is {@code null} or has a {@code null} key.
         * @throws IllegalArgumentException
         *     if a key is blank or a non-empty value is of another type.
         */
        public Builder globalAttributes(Map<String, ?> globalAttributes) {
            ArgumentUtil.checkNotNull(globalAttributes, "globalAttributes");

            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, ?> entry : globalAttributes.entrySet()) {
                ConfiguredAttributeMerger.checkAttribute(entry.getKey(), entry.getValue());
                copy.put(entry.getKey(), copyOf(entry.getValue()));
            }
            this.globalAttributes = copy;
            return this;
        }

        // Empty collections are kept as they were configured.  They are skipped when merged.
        private static Object copyOf(Object value) {
            if (value instanceof Collection<?> collection) {
                return new ArrayList<>(collection);
            }
            if (value instanceof Map<?, ?> map) {
                return new LinkedHashMap<>(map);
            }
            return value;
        }

        /**
         * Sets which metadata is attached to each dataset.
         *
         * @param metadataProfile
         *     The profile.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code metadataProfile} is {@code null}.
         */
        public Builder metadataProfile(MetadataProfile metadataProfile) {
            ArgumentUtil.checkNotNull(metadataProfile, "metadataProfile");
            this.metadataProfile = metadataProfile;
            return this;
        }

        /**
         * Sets how the observed quantities are typed.
         *
         * @param numericPolicy
         *     The policy.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code numericPolicy} is {@code null}.
         */
        public Builder numericPolicy(NumericPolicy numericPolicy) {
            ArgumentUtil.checkNotNull(numericPolicy, "numericPolicy");
            this.numericPolicy = numericPolicy;
            return this;
        }

        /**
         * Sets what happens when a file cannot be converted.
         *
         * @param failurePolicy
         *     The policy.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code failurePolicy} is {@code null}.
         */
        public Builder failurePolicy(FailurePolicy failurePolicy) {
            ArgumentUtil.checkNotNull(failurePolicy, "failurePolicy");
            this.failurePolicy = failurePolicy;
            return this;
        }

        /**
         * Builds the immutable {@code ConverterConfig} with the configured options.
         *
         * @return A {@code ConverterConfig}
         *
         * @throws IllegalStateException
         *     if the input paths or the output directory haven't been set.
         */
        public ConverterConfig build() {
            if (inputPaths.isEmpty()) {
                throw new IllegalStateException("inputPaths must be set");
            }
            if (outputDirectory == null) {
                throw new IllegalStateException("outputDirectory must be set");
            }
            return new ConverterConfig(this);
        }
    }

    /**
     * Creates a new ConverterConfig builder.
     * <p>
     * The input paths and output directory must be set before invoking {@link Builder#build build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private ConverterConfig(Builder builder) {
        this.inputPaths = builder.inputPaths;
        this.outputDirectory = builder.outputDirectory;
        this.globalAttributes = Collections.unmodifiableMap(builder.globalAttributes);
        this.metadataProfile = builder.metadataProfile;
        this.numericPolicy = builder.numericPolicy;
        this.failurePolicy = builder.failurePolicy;
    }

    /**
     * Gets the files to convert.
     *
     * @return An unmodifiable list of files, in the order in which they are converted.
     */
    public List<Path> inputPaths() {
        return inputPaths;
    }

    /**
     * Gets the directory into which NetCDF files are written.
     *
     * @return The directory. This is never {@code null}.
     */
    public Path outputDirectory() {
        return outputDirectory;
    }

    /**
     * Gets the global attributes that are added to every dataset.
     *
     * @return An unmodifiable map, in configured order.
     */
    public Map<String, Object> globalAttributes() {
        return globalAttributes;
    }

    /**
     * Gets which metadata is attached to each dataset.
     *
     * @return The profile. This is never {@code null}.
     */
    public MetadataProfile metadataProfile() {
        return metadataProfile;
    }

    /**
     * Gets how the observed quantities are typed.
     *
     * @return The policy. This is never {@code null}.
     */
    public NumericPolicy numericPolicy() {
        return numericPolicy;
    }

    /**
     * Gets what happens when a file cannot be converted.
     *
     * @return The policy. This is never {@code null}.
     */
    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }
}
