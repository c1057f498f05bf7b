package com.flowb.social.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Share link settings. When {@code domain} is set links look like
 * {@code https://<domain>/<prefix>/<code>}, otherwise they deep-link into the bot.
 */
@Component
@ConfigurationProperties(prefix = "flowb.links")
public class LinkProperties {

    private String domain = "";

    private String botUsername = "flow_b_bot";

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public String getBotUsername() {
        return botUsername;
    }

    public void setBotUsername(String botUsername) {
        this.botUsername = botUsername;
    }
}
