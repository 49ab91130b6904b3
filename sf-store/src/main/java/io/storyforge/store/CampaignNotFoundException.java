package io.storyforge.store;

public class CampaignNotFoundException extends StorageException {
    public CampaignNotFoundException(String campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
