package com.flowb.social.dto;

import lombok.Data;

/**
 * A share code and its link. {@code uses} counts attributed joins for personal crew invites.
 */
@Data
public class InviteLinkResponse {

    private String inviteCode;
    private String shareUrl;
    private int uses;

    public InviteLinkResponse() {}

    public InviteLinkResponse(String inviteCode, String shareUrl) {
        this.inviteCode = inviteCode;
        this.shareUrl = shareUrl;
    }

    public InviteLinkResponse(String inviteCode, String shareUrl, int uses) {
        this.inviteCode = inviteCode;
        this.shareUrl = shareUrl;
        this.uses = uses;
    }
}
