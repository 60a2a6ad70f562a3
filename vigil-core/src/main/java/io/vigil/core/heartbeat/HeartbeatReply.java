package io.vigil.core.heartbeat;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A heartbeat answer in the {@code STATUS: / REASON: / CONTENT:} format. A reply without a
 * recognizable status line is kept as a {@link HeartbeatStatus#CHAT_YES} message with
 * {@code unparsed} set, so nothing the model says is silently dropped.
 */
public record HeartbeatReply(HeartbeatStatus status, String reason, String content, boolean unparsed) {
    private static final Pattern STATUS = Pattern.compile(
        "^\\s*STATUS:\\s*(HEARTBEAT_OK|CHAT_YES|CHAT_NO)\\s*$",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE
    );
    private static final Pattern REASON = Pattern.compile(
        "^\\s*REASON:\\s*(.+?)(?=\\n\\s*(?:STATUS|CONTENT):|\\s*$)",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL
    );
    private static final Pattern CONTENT = Pattern.compile(
        "^\\s*CONTENT:\\s*(.+)",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL
    );

    public static HeartbeatReply parse(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        if (trimmed.isEmpty()) {
            return new HeartbeatReply(HeartbeatStatus.HEARTBEAT_OK, "empty response", "", false);
        }

        Matcher status = STATUS.matcher(trimmed);
        if (!status.find()) {
            return new HeartbeatReply(HeartbeatStatus.CHAT_YES, "unparsed response", trimmed, true);
        }

        Matcher reason = REASON.matcher(trimmed);
        Matcher content = CONTENT.matcher(trimmed);
        return new HeartbeatReply(
            HeartbeatStatus.valueOf(status.group(1).toUpperCase(Locale.ROOT)),
            reason.find() ? reason.group(1).trim() : "",
            content.find() ? content.group(1).trim() : "",
            false
        );
    }
}
