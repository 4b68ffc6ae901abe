package com.aegis.allocation.api.model;

/**
 * Where the system under classification is reachable from.
 */
public enum SystemScope {
    INTERNAL,
    EXTERNAL,
    /**
     * The intake did not state a system type.
     */
    UNSET
}
