package com.flowb.social.service.impl;

import com.flowb.social.client.FederationClient;
import com.flowb.social.dto.IdentityHints;
import com.flowb.social.dto.LinkedHandles;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.exception.ValidationException;
import com.flowb.social.model.Identity;
import com.flowb.social.repository.IdentityRepository;
import com.flowb.social.service.IdentityService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Find-and-attach identity resolution.
 *
 * A handle with a row keeps its canonical id forever. A new handle either attaches to the
 * canonical id already held by one of its federated handles, or becomes its own root.
 * Identity rows are only ever added, never rewritten.
 */
@Service
public class IdentityServiceImpl implements IdentityService {

    private static final Logger logger = LoggerFactory.getLogger(IdentityServiceImpl.class);

    private final IdentityRepository identityRepository;
    private final FederationClient federationClient;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public IdentityServiceImpl(IdentityRepository identityRepository,
                               @Autowired(required = false) FederationClient federationClient,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.identityRepository = identityRepository;
        this.federationClient = federationClient;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public String resolveCanonicalId(String platformUserId, IdentityHints hints) {
        if (platformUserId == null || platformUserId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        IdentityHints profile = hints != null ? hints : IdentityHints.none();

        Optional<Identity> existing;
        try {
            existing = identityRepository.findByPlatformUserId(platformUserId);
        } catch (RepositoryException e) {
            logger.warn("Identity lookup failed for {}, treating it as standalone", platformUserId, e);
            meterRegistry.counter("identity_resolution_total", "status", "lookup_failed").increment();
            return platformUserId;
        }
        if (existing.isPresent()) {
            meterRegistry.counter("identity_resolution_total", "status", "existing").increment();
            return existing.get().getCanonicalId();
        }

        Optional<LinkedHandles> federation;
        try {
            federation = lookupFederation(platformUserId);
        } catch (RuntimeException e) {
            logger.warn("Federation lookup failed for {}, treating it as standalone", platformUserId, e);
            meterRegistry.counter("identity_resolution_total", "status", "federation_failed").increment();
            return platformUserId;
        }
        if (federation.isEmpty()) {
            writeIdentity(newIdentity(platformUserId, platformUserId, null, profile));
            meterRegistry.counter("identity_resolution_total", "status", "standalone").increment();
            logger.debug("Minted standalone identity {}", platformUserId);
            return platformUserId;
        }

        LinkedHandles linked = federation.get();
        Set<String> otherHandles = new LinkedHashSet<>(linked.getLinkedHandles());
        otherHandles.remove(platformUserId);

        Map<String, Identity> known = findKnown(otherHandles);
        String canonicalId = otherHandles.stream()
                .filter(known::containsKey)
                .map(handle -> known.get(handle).getCanonicalId())
                .findFirst()
                .orElse(platformUserId);

        writeIdentity(newIdentity(canonicalId, platformUserId, linked.getFederationId(), profile));
        for (String handle : otherHandles) {
            if (!known.containsKey(handle)) {
                writeIdentity(newIdentity(canonicalId, handle, linked.getFederationId(), IdentityHints.none()));
            }
        }

        boolean merged = !canonicalId.equals(platformUserId);
        meterRegistry.counter("identity_resolution_total", "status", merged ? "merged" : "minted").increment();
        logger.info("Resolved {} to canonical identity {} ({} linked handles)",
                platformUserId, canonicalId, otherHandles.size());

        return storedCanonicalId(platformUserId).orElse(canonicalId);
    }

    @Override
    public List<String> getLinkedIds(String canonicalId) {
        if (canonicalId == null || canonicalId.isBlank()) {
            throw new ValidationException("Canonical id is required");
        }
        List<String> ids = new ArrayList<>();
        for (Identity identity : identityRepository.findByCanonicalId(canonicalId)) {
            ids.add(identity.getPlatformUserId());
        }
        if (!ids.contains(canonicalId)) {
            ids.add(0, canonicalId);
        }
        return ids;
    }

    private Optional<LinkedHandles> lookupFederation(String platformUserId) {
        if (federationClient == null) {
            return Optional.empty();
        }
        return federationClient.lookupLinkedHandles(platformUserId)
                .filter(linked -> linked.getLinkedHandles() != null && !linked.getLinkedHandles().isEmpty());
    }

    private Map<String, Identity> findKnown(Set<String> handles) {
        if (handles.isEmpty()) {
            return Map.of();
        }
        try {
            return identityRepository.findByPlatformUserIds(handles).stream()
                    .collect(Collectors.toMap(Identity::getPlatformUserId, Function.identity(), (a, b) -> a));
        } catch (RepositoryException e) {
            logger.warn("Could not read linked identities for {}", handles, e);
            return Map.of();
        }
    }

    /**
     * Re-read the resolving handle's row. A concurrent resolution may have written it first,
     * and the stored row is the one every later lookup will see.
     */
    private Optional<String> storedCanonicalId(String platformUserId) {
        try {
            return identityRepository.findByPlatformUserId(platformUserId).map(Identity::getCanonicalId);
        } catch (RepositoryException e) {
            logger.warn("Could not confirm identity row for {}", platformUserId, e);
            return Optional.empty();
        }
    }

    private Identity newIdentity(String canonicalId, String platformUserId, String federationId, IdentityHints hints) {
        Identity identity = new Identity(canonicalId, platformUserId, federationId);
        identity.setDisplayName(hints.getDisplayName());
        identity.setAvatarUrl(hints.getAvatarUrl());
        identity.setLinkedAt(Instant.now(clock));
        return identity;
    }

    private void writeIdentity(Identity identity) {
        try {
            identityRepository.saveIfAbsent(identity);
        } catch (RepositoryException e) {
            logger.warn("Failed to write identity row for {}", identity.getPlatformUserId(), e);
            meterRegistry.counter("identity_resolution_total", "status", "write_failed").increment();
        }
    }
}
