package org.nostree.nostr.discovery;

/**
 * Progress of a discovery run. The percentage only reaches 100 when every user is done.
 */
public final class DiscoveryProgress {

    public static final DiscoveryProgress NONE = new DiscoveryProgress(0, 0, 0);

    private final int completed;
    private final int total;
    private final int percentage;

    private DiscoveryProgress(int completed, int total, int percentage) {
        this.completed = completed;
        this.total = total;
        this.percentage = percentage;
    }

    public static DiscoveryProgress of(int completed, int total) {
        if (total <= 0) {
            return new DiscoveryProgress(0, 0, 100);
        }
        int done = Math.max(0, Math.min(completed, total));
        int percentage = (int) Math.round(done * 100.0 / total);
        if (done < total) {
            percentage = Math.min(percentage, 99);
        }
        return new DiscoveryProgress(done, total, percentage);
    }

    public int getCompleted() { return completed; }
    public int getTotal() { return total; }
    public int getPercentage() { return percentage; }

    public boolean isComplete() {
        return completed >= total;
    }

    @Override
    public String toString() {
        return completed + "/" + total + " (" + percentage + "%)";
    }
}
