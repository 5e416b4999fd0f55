package org.nostree.nostr.discovery;

/**
 * Why a discovery run was started.
 */
public enum DiscoveryTrigger {
    /** Caller asked for specific users */
    EXPLICIT,
    /** First check on a node with no recorded discovery run */
    FIRST_LOAD,
    /** The routing table has no users */
    EMPTY_TABLE,
    /** The last run is older than the refresh interval */
    REFRESH_DUE,
    /** The last run is older than the minimum interval */
    MIN_INTERVAL_ELAPSED,
    /** Periodic background refresh */
    PERIODIC;

    /**
     * Full refreshes rediscover users already seen in the current cycle.
     */
    public boolean isFullRefresh() {
        return this == EMPTY_TABLE || this == REFRESH_DUE || this == PERIODIC;
    }
}
