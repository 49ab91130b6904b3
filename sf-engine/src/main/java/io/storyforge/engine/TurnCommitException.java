package io.storyforge.engine;

/** A turn that did not commit, rethrown for callers that prefer exceptions over {@link TurnOutcome}. */
public class TurnCommitException extends RuntimeException {
    private final String campaignId;

    public TurnCommitException(String campaignId, Throwable cause) {
        super("Turn for campaign " + campaignId + " was not committed: " + cause.getMessage(), cause);
        this.campaignId = campaignId;
    }

    public String campaignId() {
        return campaignId;
    }
}
