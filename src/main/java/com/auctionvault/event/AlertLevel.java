package com.auctionvault.event;

/**
 * Severity of a {@link SecurityAlertEvent}.
 */
public enum AlertLevel {

    /** Privileged but routine change (role grant, blacklist removal). */
    INFO,

    /** Change that restricts an actor or moves treasury funds. */
    WARNING,

    /** Emergency stop engaged. */
    CRITICAL
}
