package com.frenchtoast.alert.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.frenchtoast.alert.config.AlertProperties;
import com.frenchtoast.alert.core.error.SourceException;
import com.frenchtoast.alert.core.source.StatusSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;

/**
 * Fetches the upstream XML document and extracts the text of the {@code status} element
 * directly under the document root.
 *
 * <pre>
 * &lt;toast&gt;
 *   &lt;status&gt;high&lt;/status&gt;
 *   ...
 * &lt;/toast&gt;   -&gt;  "HIGH"
 * </pre>
 */
@Component
public class XmlStatusSource implements StatusSource {

    private static final Logger log = LoggerFactory.getLogger(XmlStatusSource.class);

    static final String STATUS_ELEMENT = "status";

    private final WebClient webClient;
    private final XmlMapper xmlMapper;
    private final String statusUrl;
    private final Duration timeout;

    public XmlStatusSource(WebClient alertWebClient, XmlMapper xmlMapper, AlertProperties props) {
        this.webClient = alertWebClient;
        this.xmlMapper = xmlMapper;
        this.statusUrl = props.getStatusUrl();
        this.timeout = props.getFetchTimeout();
    }

    @Override
    public Mono<String> fetch() {
        return webClient.get()
                .uri(statusUrl)
                .accept(MediaType.APPLICATION_XML, MediaType.TEXT_XML)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(err -> !(err instanceof SourceException), this::networkFailure)
                .switchIfEmpty(Mono.error(() -> new SourceException(SourceException.Kind.MALFORMED,
                        "Empty response from " + statusUrl)))
                .map(this::parseStatus);
    }

    String parseStatus(String body) {
        JsonNode root;
        try {
            root = xmlMapper.readTree(body);
        } catch (Exception e) {
            throw new SourceException(SourceException.Kind.MALFORMED, "Invalid xml from " + statusUrl, e);
        }

        JsonNode node = root == null ? null : root.get(STATUS_ELEMENT);
        // Repeated elements are read as an array; the first one wins.
        if (node != null && node.isArray()) {
            node = node.size() == 0 ? null : node.get(0);
        }
        String status = (node == null || node.isNull() || !node.isValueNode()) ? null : node.asText();
        if (status == null || status.isBlank()) {
            throw new SourceException(SourceException.Kind.MALFORMED, "Invalid xml status: " + status);
        }

        String code = status.trim().toUpperCase(Locale.ROOT);
        log.debug("Fetched status={} from {}", code, statusUrl);
        return code;
    }

    private SourceException networkFailure(Throwable err) {
        String detail = err instanceof WebClientResponseException wre
                ? "HTTP " + wre.getStatusCode().value()
                : err.toString();
        return new SourceException(SourceException.Kind.NETWORK,
                "Failed to fetch status from " + statusUrl + ": " + detail, err);
    }
}
