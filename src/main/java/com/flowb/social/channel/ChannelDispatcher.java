package com.flowb.social.channel;

import com.flowb.social.exception.RepositoryException;
import com.flowb.social.model.Identity;
import com.flowb.social.repository.IdentityRepository;
import com.flowb.social.service.IdentityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Routes a message to the sender matching the recipient's platform prefix. When that
 * platform cannot deliver, the recipient's other linked handles are tried in sender
 * registration order.
 */
@Component
public class ChannelDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ChannelDispatcher.class);

    private final List<ChannelSender> senders;
    private final IdentityRepository identityRepository;
    private final IdentityService identityService;

    @Autowired
    public ChannelDispatcher(List<ChannelSender> senders,
                             IdentityRepository identityRepository,
                             IdentityService identityService) {
        this.senders = senders;
        this.identityRepository = identityRepository;
        this.identityService = identityService;
    }

    public boolean send(String recipientId, String text) {
        Optional<ChannelSender> primary = senderFor(recipientId);
        if (primary.isPresent() && primary.get().send(recipientId, text)) {
            return true;
        }

        List<String> linkedIds = linkedIds(recipientId);
        for (ChannelSender sender : senders) {
            for (String linkedId : linkedIds) {
                if (linkedId.equals(recipientId) || !sender.handles(linkedId)) {
                    continue;
                }
                if (sender.send(linkedId, text)) {
                    logger.debug("Delivered to {} through linked handle {}", recipientId, linkedId);
                    return true;
                }
            }
        }

        if (primary.isEmpty() && linkedIds.size() <= 1) {
            logger.debug("No channel can reach {}", recipientId);
        }
        return false;
    }

    private Optional<ChannelSender> senderFor(String userId) {
        return senders.stream().filter(sender -> sender.handles(userId)).findFirst();
    }

    private List<String> linkedIds(String recipientId) {
        try {
            return identityRepository.findByPlatformUserId(recipientId)
                .map(Identity::getCanonicalId)
                .map(identityService::getLinkedIds)
                .orElse(List.of());
        } catch (RepositoryException e) {
            logger.warn("Could not load linked handles for {}", recipientId, e);
            return List.of();
        }
    }
}
