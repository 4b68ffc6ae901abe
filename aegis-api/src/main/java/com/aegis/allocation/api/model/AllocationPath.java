package com.aegis.allocation.api.model;

/**
 * Which component produced an allocation result.
 */
public enum AllocationPath {
    /**
     * The Fast-Track gate returned the template baseline; no rule was consulted.
     */
    FAST_TRACK,

    /**
     * The full allocation rule chain was evaluated.
     */
    RULE_CHAIN
}
