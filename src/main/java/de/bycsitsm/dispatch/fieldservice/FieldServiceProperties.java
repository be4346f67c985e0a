package de.bycsitsm.dispatch.fieldservice;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the field-service platform integration.
 *
 * @param baseUrl              the API base URL (e.g. {@code https://isp.example.com/api/2.0/}); blank disables the integration
 * @param authHeader           the complete {@code Authorization} header value of a pre-provisioned API key
 * @param pageSize             number of tasks requested per page
 * @param maxPages             hard cap on the number of task pages fetched per request
 * @param directoryCacheTtl    how long fetched team and administrator lists are reused
 * @param trustAllCertificates whether self-signed certificates are accepted
 */
@ConfigurationProperties(prefix = "fieldservice")
public record FieldServiceProperties(
        String baseUrl,
        String authHeader,
        int pageSize,
        int maxPages,
        Duration directoryCacheTtl,
        boolean trustAllCertificates
) {

    public FieldServiceProperties {
        if (baseUrl == null) {
            baseUrl = "";
        }
        if (authHeader == null) {
            authHeader = "";
        }
        if (pageSize <= 0) {
            pageSize = 500;
        }
        if (maxPages <= 0) {
            maxPages = 20;
        }
        if (directoryCacheTtl == null) {
            directoryCacheTtl = Duration.ofMinutes(5);
        }
    }

    public boolean isConfigured() {
        return !baseUrl.isBlank() && !authHeader.isBlank();
    }
}
