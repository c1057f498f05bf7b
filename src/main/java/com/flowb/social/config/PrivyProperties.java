package com.flowb.social.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Credentials for the Privy user API, the account federation service.
 */
@Component
@ConfigurationProperties(prefix = "flowb.privy")
public class PrivyProperties {

    private String appId;

    private String appSecret;

    private String baseUrl = "https://auth.privy.io";

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    public String getAppSecret() {
        return appSecret;
    }

    public void setAppSecret(String appSecret) {
        this.appSecret = appSecret;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
