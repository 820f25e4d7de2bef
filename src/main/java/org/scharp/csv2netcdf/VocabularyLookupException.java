package org.scharp.csv2netcdf;

/**
 * Indicates that a variable has no entry in a {@link MetadataProfile}'s vocabulary.
 * <p>
 * This is a programming error: every variable of the station schema has an entry in every profile.
 * </p>
 */
public class VocabularyLookupException extends IllegalStateException {

    VocabularyLookupException(String message) {
        super(message);
    }
}
