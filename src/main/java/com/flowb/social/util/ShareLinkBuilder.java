package com.flowb.social.util;

import com.flowb.social.config.LinkProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds shareable links for invite codes: {@code https://<domain>/<prefix>/<code>} when a
 * short-link domain is configured, otherwise a bot deep link
 * {@code https://t.me/<bot>?start=<prefix>_<code>}.
 */
@Component
public class ShareLinkBuilder {

    public static final String FLOW_INVITE_PREFIX = "f";
    public static final String CREW_JOIN_PREFIX = "g";
    public static final String CREW_INVITE_PREFIX = "gi";

    private final LinkProperties properties;

    @Autowired
    public ShareLinkBuilder(LinkProperties properties) {
        this.properties = properties;
    }

    public String flowInvite(String code) {
        return build(FLOW_INVITE_PREFIX, code);
    }

    public String crewJoin(String joinCode) {
        return build(CREW_JOIN_PREFIX, joinCode);
    }

    public String crewInvite(String inviteCode) {
        return build(CREW_INVITE_PREFIX, inviteCode);
    }

    String build(String prefix, String code) {
        String domain = properties.getDomain();
        if (domain != null && !domain.isBlank()) {
            return "https://" + domain + "/" + prefix + "/" + code;
        }
        return "https://t.me/" + properties.getBotUsername() + "?start=" + prefix + "_" + code;
    }
}
