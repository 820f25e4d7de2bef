///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.csv2netcdf;

import java.time.Instant;
import java.util.Objects;

/**
 * Who converted a file, when, and with what.
 * <p>
 * Instances of this class are immutable.  Programs normally use {@link #current(String)}, which reads the process's
 * clock and user.  Tests can create one with fixed values so that the metadata which depends on it is predictable.
 * </p>
 */
public final class Provenance {

    private final Instant conversionTime;
    private final String user;
    private final String converterName;

    /**
     * Creates a provenance with explicit values.
     *
     * @param conversionTime
     *     When the conversion happened.
     * @param user
     *     The user (or session) that invoked the conversion.
     * @param converterName
     *     The name of the program that did the conversion.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code user} or {@code converterName} is blank.
     */
    public Provenance(Instant conversionTime, String user, String converterName) {
        ArgumentUtil.checkNotNull(conversionTime, "conversionTime");
        ArgumentUtil.checkNotBlank(user, "user");
        ArgumentUtil.checkNotBlank(converterName, "converterName");

        this.conversionTime = conversionTime;
        this.user = user;
        this.converterName = converterName;
    }

    /**
     * Creates a provenance for a conversion that happens now, invoked by the user who is running this process.
     *
     * @param converterName
     *     The name of the program that does the conversion.
     *
     * @return A new provenance.
     */
    public static Provenance current(String converterName) {
        String user = System.getProperty("user.name");
        if (user == null || user.isBlank()) {
            user = "unknown";
        }
        return new Provenance(Instant.now(), user, converterName);
    }

    /**
     * Gets when the conversion happened.
     *
     * @return The instant. This is never {@code null}.
     */
    public Instant conversionTime() {
        return conversionTime;
    }

    /**
     * Gets who invoked the conversion.
     *
     * @return The user name. This is never {@code null}.
     */
    public String user() {
        return user;
    }

    /**
     * Gets the name of the program that did the conversion.
     *
     * @return The converter's name. This is never {@code null}.
     */
    public String converterName() {
        return converterName;
    }

    @Override
    public int hashCode() {
        return Objects.hash(conversionTime, user, converterName);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Provenance otherProvenance)) {
            return false;
        }
        return conversionTime.equals(otherProvenance.conversionTime) &&
            user.equals(otherProvenance.user) &&
            converterName.equals(otherProvenance.converterName);
    }
}
