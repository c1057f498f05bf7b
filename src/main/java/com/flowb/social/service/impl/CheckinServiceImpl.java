package com.flowb.social.service.impl;

import com.flowb.social.config.NotificationProperties;
import com.flowb.social.dto.CheckinResult;
import com.flowb.social.exception.ResourceNotFoundException;
import com.flowb.social.exception.UnauthorizedException;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.Checkin;
import com.flowb.social.model.CrewMembership;
import com.flowb.social.model.Platform;
import com.flowb.social.repository.CheckinRepository;
import com.flowb.social.repository.CrewRepository;
import com.flowb.social.service.CheckinService;
import com.flowb.social.service.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class CheckinServiceImpl implements CheckinService {

    private static final Logger logger = LoggerFactory.getLogger(CheckinServiceImpl.class);

    private final CheckinRepository checkinRepository;
    private final CrewRepository crewRepository;
    private final NotificationService notificationService;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    @Autowired
    public CheckinServiceImpl(CheckinRepository checkinRepository,
                              CrewRepository crewRepository,
                              NotificationService notificationService,
                              NotificationProperties notificationProperties,
                              Clock clock) {
        this.checkinRepository = checkinRepository;
        this.crewRepository = crewRepository;
        this.notificationService = notificationService;
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    @Override
    public CheckinResult checkIn(String userId, String crewId, String venueName, String message) {
        if (venueName == null || venueName.isBlank()) {
            throw new ValidationException("Venue name is required");
        }
        requireMember(userId, crewId);

        Instant now = Instant.now(clock);
        Checkin checkin = new Checkin();
        checkin.setUserId(userId);
        checkin.setPlatform(Platform.fromUserId(userId));
        checkin.setCrewId(crewId);
        checkin.setVenueName(venueName.trim());
        checkin.setMessage(message);
        checkin.setCreatedAt(now);
        checkin.setExpiresAt(now.plus(notificationProperties.getCheckinLifetime()));

        Checkin saved = checkinRepository.save(checkin);
        logger.info("User {} checked in at {} with crew {}", userId, checkin.getVenueName(), crewId);

        int notified = 0;
        try {
            notified = notificationService.notifyCheckin(userId, crewId, checkin.getVenueName());
        } catch (RuntimeException e) {
            logger.warn("Check-in notification failed for {} in crew {}", userId, crewId, e);
        }
        return new CheckinResult(saved != null ? saved : checkin, notified);
    }

    @Override
    public int locateCrew(String userId, String crewId) {
        requireMember(userId, crewId);

        Set<String> checkedIn = checkinRepository.findActiveForCrew(crewId, Instant.now(clock)).stream()
            .map(Checkin::getUserId)
            .collect(Collectors.toSet());
        List<String> missing = crewRepository.findMembers(crewId).stream()
            .map(CrewMembership::getUserId)
            .filter(id -> !id.equals(userId) && !checkedIn.contains(id))
            .collect(Collectors.toList());

        if (!missing.isEmpty()) {
            try {
                notificationService.notifyCrewLocate(userId, crewId, missing);
            } catch (RuntimeException e) {
                logger.warn("Locate ping failed for crew {}", crewId, e);
            }
        }
        return missing.size();
    }

    private void requireMember(String userId, String crewId) {
        if (userId == null || userId.isBlank() || crewId == null || crewId.isBlank()) {
            throw new ValidationException("User id and crew id are required");
        }
        if (crewRepository.findById(crewId).isEmpty()) {
            throw new ResourceNotFoundException("Crew not found: " + crewId);
        }
        if (crewRepository.findMembership(crewId, userId).isEmpty()) {
            throw new UnauthorizedException("Only crew members can do that");
        }
    }
}
