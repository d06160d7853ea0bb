package com.issuepilot.orchestrator.protocol;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Machine-readable markers hidden in claim and release comments.
 *
 *   &lt;!-- issuepilot:claim owner=host-1234 claimed=2025-01-01T10:00:00Z heartbeat=2025-01-01T10:05:00Z --&gt;
 *   &lt;!-- issuepilot:release owner=host-1234 outcome=DONE --&gt;
 *
 * A release marker closes the current claim epoch; the next claim marker opens
 * a new one.
 */
public record ClaimMarker(String owner, Instant claimedAt, Instant heartbeatAt) {

    private static final Pattern CLAIM = Pattern.compile(
            "<!-- issuepilot:claim owner=(\\S+) claimed=(\\S+) heartbeat=(\\S+) -->");
    private static final Pattern RELEASE = Pattern.compile(
            "<!-- issuepilot:release owner=(\\S+) outcome=(\\S+) -->");

    public String render() {
        return "<!-- issuepilot:claim owner=" + owner + " claimed=" + claimedAt
                + " heartbeat=" + heartbeatAt + " -->";
    }

    public static Optional<ClaimMarker> parse(String body) {
        if (body == null) return Optional.empty();
        Matcher m = CLAIM.matcher(body);
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(new ClaimMarker(m.group(1), Instant.parse(m.group(2)), Instant.parse(m.group(3))));
        } catch (DateTimeParseException e) {
            // Hand-edited marker: not ours to trust.
            return Optional.empty();
        }
    }

    public static String renderRelease(String owner, String outcome) {
        return "<!-- issuepilot:release owner=" + owner + " outcome=" + outcome + " -->";
    }

    public static boolean isRelease(String body) {
        return body != null && RELEASE.matcher(body).find();
    }
}
