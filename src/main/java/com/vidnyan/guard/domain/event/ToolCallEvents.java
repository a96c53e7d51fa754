package com.vidnyan.guard.domain.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds typed events from the host's untyped tool name and parameters.
 */
public final class ToolCallEvents {

    /**
     * @throws EventExtractionException when the tool is unknown or its candidate is absent
     */
    public static ToolCallEvent extract(String toolName, Map<String, ?> params) throws EventExtractionException {
        if (toolName == null || toolName.isBlank()) {
            throw new EventExtractionException(toolName, "Missing tool name");
        }
        Map<String, ?> p = params == null ? Map.of() : params;

        return switch (toolName.trim().toLowerCase(Locale.ROOT)) {
            case "exec", "bash", "shell" -> new ExecEvent(require(toolName, p, "command"));
            case "write" -> new FileWriteEvent(requirePath(toolName, p), text(p, "content"));
            case "edit" -> new FileEditEvent(
                    requirePath(toolName, p),
                    firstText(p, "old_string", "oldText"),
                    firstText(p, "new_string", "newText", "content"));
            case "multiedit" -> new FileEditEvent(
                    requirePath(toolName, p),
                    joinEdits(p, "old_string", "oldText"),
                    joinEdits(p, "new_string", "newText"));
            case "read" -> new FileReadEvent(requirePath(toolName, p));
            case "web_fetch", "webfetch", "fetch", "http_request" -> new HttpRequestEvent(require(toolName, p, "url"));
            default -> throw new EventExtractionException(toolName, "Unrecognized tool: " + toolName);
        };
    }

    /**
     * MultiEdit carries its changes in an {@code edits} array. Every edit's text
     * is joined, one per line, so content checks see all of them.
     */
    private static String joinEdits(Map<?, ?> params, String... keys) {
        List<String> parts = new ArrayList<>();
        String topLevel = firstText(params, keys);
        if (topLevel != null) {
            parts.add(topLevel);
        }
        if (params.get("edits") instanceof List<?> edits) {
            for (Object edit : edits) {
                if (edit instanceof Map<?, ?> fields) {
                    String value = firstText(fields, keys);
                    if (value != null) {
                        parts.add(value);
                    }
                }
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    private static String requirePath(String toolName, Map<String, ?> params) throws EventExtractionException {
        String path = firstText(params, "path", "file_path", "filePath");
        if (path == null || path.isBlank()) {
            throw new EventExtractionException(toolName, "No target path in parameters");
        }
        return path;
    }

    private static String require(String toolName, Map<String, ?> params, String key) throws EventExtractionException {
        String value = text(params, key);
        if (value == null || value.isBlank()) {
            throw new EventExtractionException(toolName, "No '" + key + "' in parameters");
        }
        return value;
    }

    private static String firstText(Map<?, ?> params, String... keys) {
        for (String key : keys) {
            String value = text(params, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(Map<?, ?> params, String key) {
        Object value = params.get(key);
        return value instanceof String s ? s : null;
    }

    private ToolCallEvents() {}
}
