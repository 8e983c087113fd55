package com.acme.corna.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Public URLs handed out to clients.
 *
 * @param apiBaseUrl unversioned API root, e.g. {@code https://api.mycorna.com}
 */
@ConfigurationProperties(prefix = "app.links")
public record LinkProperties(String apiBaseUrl) {

    public String mediaDownload(String urlExtension) {
        return apiBaseUrl + "/v1/media/download/" + urlExtension;
    }

    public String post(String domainName, String type, String urlExtension) {
        return apiBaseUrl + "/v1/posts/" + domainName + "/" + type + "/" + urlExtension;
    }
}
