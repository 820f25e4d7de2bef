package org.scharp.csv2netcdf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link ConverterConfig} from a YAML file.
 * <p>
 * A configuration file looks like this:
 * </p>
 * <pre>
 * input_path:
 *   - data/station-1.csv
 *   - data/station-2.csv
 * output_path:
 *   - out
 * global_attributes:
 *   institution: Marine Observatory
 *   license: CC-BY-4.0
 * metadata_profile: cf      # units_only (default) or cf
 * numeric_policy: mixed     # all_float (default) or mixed
 * on_error: continue        # abort (default) or continue
 * </pre>
 * <p>
 * {@code input_path} and {@code output_path} may also be given as a single string.  Only the first entry of
 * {@code output_path} is used.  Relative paths are resolved against the working directory.
 * </p>
 */
public final class ConfigLoader {

    static final String INPUT_PATH = "input_path";
    static final String OUTPUT_PATH = "output_path";
    static final String GLOBAL_ATTRIBUTES = "global_attributes";
    static final String METADATA_PROFILE = "metadata_profile";
    static final String NUMERIC_POLICY = "numeric_policy";
    static final String ON_ERROR = "on_error";

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    /**
     * Creates a configuration loader.
     */
    public ConfigLoader() {
        mapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Reads a configuration file.
     *
     * @param configFile
     *     The YAML file to read.
     *
     * @return The configuration.
     *
     * @throws NullPointerException
     *     if {@code configFile} is {@code null}.
     * @throws ConfigurationException
     *     if the file cannot be read, is not a YAML mapping, lacks a required key, or has a malformed value.
     */
    public ConverterConfig load(Path configFile) throws ConfigurationException {
        ArgumentUtil.checkNotNull(configFile, "configFile");

        Map<String, Object> document;
        try (InputStream inputStream = Files.newInputStream(configFile)) {
            document = mapper.readValue(inputStream, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(configFile, "is not a YAML mapping", e);
        } catch (IOException e) {
            throw new ConfigurationException(configFile, "could not be read", e);
        }
        if (document == null) {
            throw new ConfigurationException(configFile, "is empty");
        }

        try {
            ConverterConfig.Builder builder = ConverterConfig.builder().
                inputPaths(paths(configFile, document, INPUT_PATH)).
                outputDirectory(paths(configFile, document, OUTPUT_PATH).get(0));

            Object globalAttributes = document.get(GLOBAL_ATTRIBUTES);
            if (globalAttributes instanceof Map<?, ?> attributeMap) {
                builder.globalAttributes(stringKeys(configFile, attributeMap));
            } else if (globalAttributes != null) {
                throw new ConfigurationException(configFile, GLOBAL_ATTRIBUTES + " must be a mapping");
            }

            String metadataProfile = optionalString(configFile, document, METADATA_PROFILE);
            if (metadataProfile != null) {
                builder.metadataProfile(MetadataProfile.fromConfigValue(metadataProfile));
            }
            String numericPolicy = optionalString(configFile, document, NUMERIC_POLICY);
            if (numericPolicy != null) {
                builder.numericPolicy(NumericPolicy.fromConfigValue(numericPolicy));
            }
            String failurePolicy = optionalString(configFile, document, ON_ERROR);
            if (failurePolicy != null) {
                builder.failurePolicy(FailurePolicy.fromConfigValue(failurePolicy));
            }

            return builder.build();
        } catch (IllegalArgumentException e) {
            // A value that the builder rejected.
            throw new ConfigurationException(configFile, e.getMessage(), e);
        }
    }

    private static List<Path> paths(Path configFile, Map<String, Object> document, String key)
        throws ConfigurationException {

        Object value = document.get(key);
        List<Object> entries = new ArrayList<>();
        if (value instanceof String) {
            entries.add(value);
        } else if (value instanceof List<?> list) {
            entries.addAll(list);
        } else if (value == null) {
            throw new ConfigurationException(configFile, "missing required key " + key);
        } else {
            throw new ConfigurationException(configFile, key + " must be a path or a list of paths");
        }

        if (entries.isEmpty()) {
            throw new ConfigurationException(configFile, key + " must not be empty");
        }
        List<Path> paths = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (!(entry instanceof String text) || text.isBlank()) {
                throw new ConfigurationException(configFile, key + " entries must be non-blank paths");
            }
            try {
                paths.add(Path.of(text));
            } catch (InvalidPathException e) {
                throw new ConfigurationException(configFile, key + " has an invalid path \"" + text + "\"", e);
            }
        }
        return paths;
    }

    private static String optionalString(Path configFile, Map<String, Object> document, String key)
        throws ConfigurationException {

        Object value = document.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new ConfigurationException(configFile, key + " must be a string");
    }

    private static Map<String, Object> stringKeys(Path configFile, Map<?, ?> map) throws ConfigurationException {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new ConfigurationException(configFile, GLOBAL_ATTRIBUTES + " keys must be strings");
            }
            attributes.put(name, entry.getValue());
        }
        return attributes;
    }
}
