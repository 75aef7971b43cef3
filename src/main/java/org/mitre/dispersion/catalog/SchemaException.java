package org.mitre.dispersion.catalog;

import java.util.Set;

/**
 * Thrown when candidate data lacks a required field entirely (as opposed to a few rows having
 * blank values). No partial result is produced.
 */
public class SchemaException extends RuntimeException {

    private final Set<String> missingFields;

    public SchemaException(Set<String> missingFields) {
        super("City data must contain these columns: " + missingFields);
        this.missingFields = Set.copyOf(missingFields);
    }

    public Set<String> missingFields() {
        return missingFields;
    }
}
