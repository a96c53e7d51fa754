package com.vidnyan.guard.domain.rule;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Normalization applied to candidate strings and keyword needles before matching.
 */
public final class CandidateNormalizer {

    /**
     * Backslash and forward slash are the same path separator.
     */
    public static String separators(String value) {
        return value == null ? "" : value.replace('\\', '/');
    }

    /**
     * Forward-slash form of a path with repeated separators collapsed and
     * {@code .} / {@code ..} segments resolved lexically. A leading {@code ..}
     * on a relative path is kept; one above the root of an absolute path is dropped.
     */
    public static String canonicalPath(String value) {
        String path = separators(value);
        if (path.isEmpty()) {
            return path;
        }
        boolean absolute = path.startsWith("/");
        boolean directory = path.endsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                    continue;
                }
                if (absolute) {
                    continue;
                }
            }
            segments.addLast(segment);
        }
        StringBuilder sb = new StringBuilder();
        if (absolute) {
            sb.append('/');
        }
        sb.append(String.join("/", segments));
        if (directory && !segments.isEmpty()) {
            sb.append('/');
        }
        return sb.toString();
    }

    /**
     * Collapse runs of whitespace into a single space and trim.
     */
    public static String collapseWhitespace(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ");
    }

    /**
     * Commands are matched without regard to letter case; paths and URLs are not.
     */
    public static boolean ignoreCase(ToolKind kind) {
        return kind == ToolKind.EXEC;
    }

    /**
     * Whether {@code path}, once canonical, contains {@code protectedPath}.
     * Separator-agnostic and case-insensitive.
     */
    public static boolean pathContains(String path, String protectedPath) {
        String haystack = canonicalPath(path).toLowerCase(Locale.ROOT);
        String needle = separators(protectedPath).toLowerCase(Locale.ROOT);
        return !needle.isEmpty() && haystack.contains(needle);
    }

    private CandidateNormalizer() {}
}
