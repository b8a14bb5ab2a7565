package com.buildscheduler.connector;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Folder-qualified job name. Accepts {@code a/b/c}, {@code a/job/b/job/c} and
 * {@code job/a/job/b}; each segment is URL-encoded exactly once when the path is rendered.
 */
public final class JenkinsJobPath {

    private static final String DELIMITER = "job";

    private final List<String> segments;

    private JenkinsJobPath(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    public static JenkinsJobPath of(List<String> segments) {
        return new JenkinsJobPath(segments);
    }

    public static JenkinsJobPath parse(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Target job path is required");
        }
        String trimmed = target.trim().replaceAll("^/+|/+$", "");
        boolean delimited = trimmed.startsWith(DELIMITER + "/") || trimmed.contains("/" + DELIMITER + "/");
        if (trimmed.startsWith(DELIMITER + "/")) {
            trimmed = trimmed.substring(DELIMITER.length() + 1);
        }

        List<String> segments = new ArrayList<>();
        boolean expectName = true;
        for (String token : trimmed.split("/")) {
            if (token.isEmpty()) {
                continue;
            }
            if (delimited && !expectName && DELIMITER.equals(token)) {
                expectName = true;
                continue;
            }
            segments.add(token);
            expectName = false;
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Target job path is required");
        }
        return new JenkinsJobPath(segments);
    }

    public List<String> segments() {
        return segments;
    }

    public JenkinsJobPath child(String name) {
        List<String> next = new ArrayList<>(segments);
        next.add(name);
        return new JenkinsJobPath(next);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** Slash-joined plain name, the form stored in job configurations. */
    public String fullName() {
        return String.join("/", segments);
    }

    /** URL path below the server root, e.g. {@code /job/team%20a/job/deploy}. */
    public String toUrlPath() {
        StringBuilder path = new StringBuilder();
        for (String segment : segments) {
            path.append('/').append(DELIMITER).append('/')
                    .append(UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8));
        }
        return path.toString();
    }

    @Override
    public String toString() {
        return fullName();
    }
}
