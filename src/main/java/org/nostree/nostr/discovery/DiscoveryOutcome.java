package org.nostree.nostr.discovery;

import org.nostree.nostr.outbox.DiscoveryResult;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What a trigger led to.
 */
public final class DiscoveryOutcome {

    public enum Status {
        /** Every batch was attempted */
        COMPLETED,
        /** Stopped between batches by {@link DiscoveryScheduler#cancel()} */
        CANCELLED,
        /** Nothing to do, or another run was in progress */
        SKIPPED,
        /** Aborted by an unexpected error */
        FAILED
    }

    private final Status status;
    private final Set<DiscoveryTrigger> triggers;
    private final int usersRequested;
    private final DiscoveryResult result;
    private final String reason;

    private DiscoveryOutcome(Status status, Set<DiscoveryTrigger> triggers, int usersRequested,
                             DiscoveryResult result, String reason) {
        this.status = status;
        this.triggers = triggers.isEmpty()
                ? Collections.<DiscoveryTrigger>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(triggers));
        this.usersRequested = usersRequested;
        this.result = result;
        this.reason = reason;
    }

    static DiscoveryOutcome skipped(Set<DiscoveryTrigger> triggers, String reason) {
        return new DiscoveryOutcome(Status.SKIPPED, triggers, 0, DiscoveryResult.success(0, 0), reason);
    }

    static DiscoveryOutcome finished(Status status, Set<DiscoveryTrigger> triggers, int usersRequested,
                                     DiscoveryResult result, String reason) {
        return new DiscoveryOutcome(status, triggers, usersRequested, result, reason);
    }

    public Status getStatus() { return status; }
    public Set<DiscoveryTrigger> getTriggers() { return triggers; }
    public int getUsersRequested() { return usersRequested; }

    /**
     * Sum of the batch results of the run.
     */
    public DiscoveryResult getResult() { return result; }

    /**
     * Why the run was skipped or failed, null otherwise.
     */
    public String getReason() { return reason; }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    @Override
    public String toString() {
        return "DiscoveryOutcome{" + status + ", triggers=" + triggers +
                ", users=" + usersRequested + ", " + result +
                (reason != null ? ", reason='" + reason + '\'' : "") + '}';
    }
}
