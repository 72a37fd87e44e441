package com.Tkmind.recall_bridge.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Meeting link helpers: allow-listing, platform detection and the cleaning
 * that produces the bot dedup key.
 */
@Slf4j
public final class MeetingUrls {

    public static final String ZOOM = "zoom";
    public static final String MEET = "meet";
    public static final String TEAMS = "teams";

    // host suffix -> platform
    private static final Map<String, String> SUPPORTED_HOSTS = Map.of(
            "zoom.us", ZOOM,
            "meet.google.com", MEET,
            "teams.microsoft.com", TEAMS,
            "teams.live.com", TEAMS
    );

    private static final Pattern ZOOM_ID = Pattern.compile("zoom\\.us/j/(\\d+)");
    private static final Pattern MEET_ID = Pattern.compile("meet\\.google\\.com/([a-z-]+)");
    private static final Pattern TEAMS_ID = Pattern.compile("teams\\.microsoft\\.com.*meetup-join/([^?]+)");

    private MeetingUrls() {
    }

    public static boolean isSupported(String meetingUrl) {
        return platformOf(meetingUrl).isPresent();
    }

    public static Optional<String> platformOf(String meetingUrl) {
        String host = hostOf(meetingUrl);
        if (host == null) {
            return Optional.empty();
        }
        return SUPPORTED_HOSTS.entrySet().stream()
                .filter(e -> host.equals(e.getKey()) || host.endsWith("." + e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * Canonical form used as the dedup key. Google Meet keeps only the meeting
     * code path, Zoom keeps scheme/host/path plus the pwd parameter, Teams links
     * are left untouched. Unparseable input is returned as is. Idempotent.
     */
    public static String clean(String meetingUrl) {
        if (meetingUrl == null) {
            return null;
        }
        String trimmed = meetingUrl.trim();
        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(trimmed).build();
        } catch (IllegalArgumentException e) {
            log.warn("Could not parse meeting URL, using as-is: {}", trimmed);
            return trimmed;
        }
        String host = uri.getHost();
        if (host == null) {
            return trimmed;
        }
        host = host.toLowerCase(Locale.ROOT);
        String path = uri.getPath() != null ? uri.getPath() : "";

        if (host.equals("meet.google.com")) {
            return "https://meet.google.com" + path;
        }

        if (host.equals("zoom.us") || host.endsWith(".zoom.us")) {
            String origin = (uri.getScheme() != null ? uri.getScheme() : "https") + "://" + host
                    + (uri.getPort() != -1 ? ":" + uri.getPort() : "");
            String pwd = uri.getQueryParams().getFirst("pwd");
            return origin + path + (pwd != null && !pwd.isEmpty() ? "?pwd=" + pwd : "");
        }

        return trimmed;
    }

    public static Optional<String> extractMeetingId(String meetingUrl) {
        if (meetingUrl == null) {
            return Optional.empty();
        }
        for (Pattern pattern : new Pattern[]{ZOOM_ID, MEET_ID, TEAMS_ID}) {
            Matcher matcher = pattern.matcher(meetingUrl);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    private static String hostOf(String meetingUrl) {
        if (meetingUrl == null || meetingUrl.isBlank()) {
            return null;
        }
        try {
            String host = UriComponentsBuilder.fromUriString(meetingUrl.trim()).build().getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
