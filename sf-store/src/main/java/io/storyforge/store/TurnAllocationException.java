package io.storyforge.store;

/** The turn-number compare-and-swap kept losing; signals abnormal contention on one campaign. */
public class TurnAllocationException extends StorageException {
    private final String campaignId;
    private final int attempts;

    public TurnAllocationException(String campaignId, int attempts) {
        super("Could not allocate a turn number for campaign " + campaignId + " after " + attempts + " attempts");
        this.campaignId = campaignId;
        this.attempts = attempts;
    }

    public TurnAllocationException(String campaignId, int attempts, Throwable cause) {
        super("Turn allocation for campaign " + campaignId + " interrupted after " + attempts + " attempts", cause);
        this.campaignId = campaignId;
        this.attempts = attempts;
    }

    public String campaignId() {
        return campaignId;
    }

    public int attempts() {
        return attempts;
    }
}
