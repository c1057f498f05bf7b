package com.flowb.social.service;

import com.flowb.social.dto.NotifyTargets;
import com.flowb.social.model.NotificationType;

/**
 * Computes who should hear about an RSVP, for callers that deliver messages themselves.
 */
public interface NotificationTargetingService {

    /**
     * Friends and crew co-members of the actor who have not yet been told about the actor's RSVP
     * to {@code eventId} under either RSVP notification type. A friend who is also a crew-mate is
     * listed as a friend only, and someone sharing several crews under the first of them.
     * Crews left with nobody are dropped.
     */
    NotifyTargets computeTargets(String actorId, String eventId);

    /**
     * Record a delivery made outside the dispatcher, closing the loop for {@link #computeTargets}.
     */
    void logNotification(String recipientId, NotificationType type, String referenceId, String triggeredBy);
}
