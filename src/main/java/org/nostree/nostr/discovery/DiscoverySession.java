package org.nostree.nostr.discovery;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One discovery run. Lives only in memory.
 */
public final class DiscoverySession {

    private final String batchId;
    private final List<String> userIds;
    private final long startedAt;
    private volatile int completed;

    DiscoverySession(List<String> userIds, long startedAt) {
        this.batchId = UUID.randomUUID().toString();
        this.userIds = Collections.unmodifiableList(userIds);
        this.startedAt = startedAt;
    }

    public String getBatchId() { return batchId; }
    public List<String> getUserIds() { return userIds; }
    public long getStartedAt() { return startedAt; }
    public int getCompleted() { return completed; }
    public int getTotal() { return userIds.size(); }

    public DiscoveryProgress getProgress() {
        return DiscoveryProgress.of(completed, userIds.size());
    }

    /**
     * Advance the completed count; never moves backwards.
     */
    void advance(int count) {
        completed = Math.min(userIds.size(), completed + Math.max(0, count));
    }

    @Override
    public String toString() {
        return "DiscoverySession{" + batchId + ", " + getProgress() + '}';
    }
}
