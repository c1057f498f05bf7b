package com.flowb.social.service;

import com.flowb.social.dto.AcceptInviteResult;
import com.flowb.social.dto.FlowListing;
import com.flowb.social.dto.InviteLinkResponse;
import com.flowb.social.model.ConnectionStatus;

/**
 * Symmetric friend connections, stored as one row per direction.
 */
public interface ConnectionService {

    /**
     * The caller's personal flow invite link, created on first use and stable afterwards.
     */
    InviteLinkResponse getInviteLink(String userId);

    AcceptInviteResult acceptInvite(String userId, String inviteCode);

    /**
     * Delete both directions of a friendship. Removing a missing connection succeeds.
     */
    void removeConnection(String userId, String friendId);

    /**
     * Toggle the caller's own row between active and muted.
     * @return the caller's new status toward {@code friendId}
     */
    ConnectionStatus toggleMute(String userId, String friendId);

    FlowListing listFlow(String userId);
}
