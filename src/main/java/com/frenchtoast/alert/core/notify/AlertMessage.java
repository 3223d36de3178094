package com.frenchtoast.alert.core.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.frenchtoast.alert.core.model.AlertLevel;

import java.time.Instant;
import java.util.List;

/**
 * Slack incoming-webhook message envelope carrying one attachment per status level.
 *
 * <pre>
 * {"attachments":[{"color":"#FF821D","author_name":"French Toast Alert System",
 *   "author_link":"...","title":"4 Slices / High","text":"...","thumb_url":"...","ts":1700000000}]}
 * </pre>
 */
public record AlertMessage(List<Attachment> attachments) {

    public static final String AUTHOR_NAME = "French Toast Alert System";

    /**
     * @param updated  the status row's {@code updated} timestamp; sent as Unix seconds
     * @param linkUrl  informational link shown as the attachment author
     */
    public static AlertMessage of(AlertLevel level, Instant updated, String linkUrl) {
        return new AlertMessage(List.of(new Attachment(
                level.color(),
                AUTHOR_NAME,
                linkUrl,
                level.title(),
                level.text(),
                level.imageUrl(),
                updated.getEpochSecond())));
    }

    public record Attachment(
            String color,
            @JsonProperty("author_name") String authorName,
            @JsonProperty("author_link") String authorLink,
            String title,
            String text,
            @JsonProperty("thumb_url") String thumbUrl,
            long ts) {
    }
}
