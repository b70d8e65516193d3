package com.optionscalper.domain.enums;

/**
 * Account-health indicator derived from the per-endpoint circuit breakers.
 *
 * <ul>
 *   <li>NONE: every guarded endpoint is healthy</li>
 *   <li>PARTIAL: at least one endpoint is probing recovery (half-open)</li>
 *   <li>DEGRADED: at least one endpoint is blocked; cached values are being shown</li>
 * </ul>
 */
public enum DegradationLevel {
    NONE,
    PARTIAL,
    DEGRADED
}
