package org.mitre.dispersion;

/**
 * A non-fatal shortfall in a dispersed selection. A result carrying no warnings fully satisfied
 * its request: it has the requested size and every pair of members honors the minimum distance.
 */
public interface SelectionWarning {

    /** @return A human-readable description of the shortfall. */
    String message();
}
