package com.flowb.social.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "flowb.crews")
public class CrewProperties {

    private int defaultMaxMembers = 50;

    private String defaultEmoji = "🔥";

    private int joinCodeLength = 6;

    private int inviteCodeLength = 8;

    private int browseLimit = 20;

    public int getDefaultMaxMembers() {
        return defaultMaxMembers;
    }

    public void setDefaultMaxMembers(int defaultMaxMembers) {
        this.defaultMaxMembers = defaultMaxMembers;
    }

    public String getDefaultEmoji() {
        return defaultEmoji;
    }

    public void setDefaultEmoji(String defaultEmoji) {
        this.defaultEmoji = defaultEmoji;
    }

    public int getJoinCodeLength() {
        return joinCodeLength;
    }

    public void setJoinCodeLength(int joinCodeLength) {
        this.joinCodeLength = joinCodeLength;
    }

    public int getInviteCodeLength() {
        return inviteCodeLength;
    }

    public void setInviteCodeLength(int inviteCodeLength) {
        this.inviteCodeLength = inviteCodeLength;
    }

    public int getBrowseLimit() {
        return browseLimit;
    }

    public void setBrowseLimit(int browseLimit) {
        this.browseLimit = browseLimit;
    }
}
