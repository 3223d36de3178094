package com.frenchtoast.alert.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Process-wide settings of the alert engine, constructed once at startup and injected into
 * each component.
 *
 * <h2>Binding</h2>
 * Bound from the prefix {@code frenchtoast}, e.g.:
 * <pre>
 * frenchtoast:
 *   status-url: https://www.universalhub.com/toast.xml
 *   link-url: https://www.universalhub.com/french-toast
 *   token-key: ${TOKEN_KEY}
 *   fetch-timeout: 5s
 *   delivery-timeout: 5s
 *   delivery-concurrency: 8
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>{@code token-key} is a Base64 encoded 256-bit AES key. Generate with
 *       {@code openssl rand -base64 32}. Changing it makes every stored delivery URL unreadable.</li>
 *   <li>Timeouts bound every outbound call; a hung feed or webhook endpoint cannot stall a cycle.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "frenchtoast")
public class AlertProperties {

    /** Upstream XML feed carrying the {@code status} element. */
    private String statusUrl;

    /** Informational link placed in the {@code author_link} field of every notification. */
    private String linkUrl;

    /** Base64 AES-256 key used to encrypt delivery URLs at rest. */
    private String tokenKey;

    private Duration fetchTimeout = Duration.ofSeconds(5);

    private Duration deliveryTimeout = Duration.ofSeconds(5);

    /** Max webhook POSTs in flight during one fanout. */
    private int deliveryConcurrency = 8;

    public String getStatusUrl() { return statusUrl; }
    public void setStatusUrl(String statusUrl) { this.statusUrl = statusUrl; }

    public String getLinkUrl() { return linkUrl; }
    public void setLinkUrl(String linkUrl) { this.linkUrl = linkUrl; }

    public String getTokenKey() { return tokenKey; }
    public void setTokenKey(String tokenKey) { this.tokenKey = tokenKey; }

    public Duration getFetchTimeout() { return fetchTimeout; }
    public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

    public Duration getDeliveryTimeout() { return deliveryTimeout; }
    public void setDeliveryTimeout(Duration deliveryTimeout) { this.deliveryTimeout = deliveryTimeout; }

    public int getDeliveryConcurrency() { return deliveryConcurrency; }
    public void setDeliveryConcurrency(int deliveryConcurrency) { this.deliveryConcurrency = deliveryConcurrency; }
}
