package org.scharp.csv2netcdf;

import java.util.Locale;

/**
 * What a {@link ConversionBatch} does when a file cannot be converted.
 */
public enum FailurePolicy {

    /** Stop at the first file that fails.  The remaining files are not converted. */
    ABORT,

    /** Record the failure and go on with the next file. */
    CONTINUE;

    /**
     * Gets the policy for a value given in a configuration file, like {@code abort} or {@code continue}.
     *
     * @param configValue
     *     The configured value. Case is ignored.
     *
     * @return The policy.
     *
     * @throws NullPointerException
     *     if {@code configValue} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code configValue} doesn't name a policy.
     */
    public static FailurePolicy fromConfigValue(String configValue) {
        ArgumentUtil.checkNotNull(configValue, "failure policy");
        for (FailurePolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(configValue.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
            "unknown failure policy \"" + configValue + "\" (expected abort or continue)");
    }

    /**
     * Gets the value which selects this policy in a configuration file.
     *
     * @return The configuration value, like {@code abort}.
     */
    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
