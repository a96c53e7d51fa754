package com.vidnyan.guard.domain.rule;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of tool calls a rule can be scoped to.
 */
public enum ToolKind {
    EXEC("exec"),
    FILE_READ("file_read"),
    FILE_WRITE("file_write"),
    FILE_EDIT("file_edit"),
    FILE_DELETE("file_delete"),
    HTTP_REQUEST("http_request"),
    GIT_OPERATION("git_operation");

    private final String wireName;

    ToolKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * True for kinds whose candidate string is a file path.
     */
    public boolean isPathBearing() {
        return this == FILE_READ || this == FILE_WRITE || this == FILE_EDIT || this == FILE_DELETE;
    }

    /**
     * Parse a snake_case kind as it appears in rule records. Accepts the short
     * aliases the control plane has historically emitted ("read", "write", ...).
     */
    public static Optional<ToolKind> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "exec" -> Optional.of(EXEC);
            case "file_read", "read" -> Optional.of(FILE_READ);
            case "file_write", "write" -> Optional.of(FILE_WRITE);
            case "file_edit", "edit" -> Optional.of(FILE_EDIT);
            case "file_delete", "delete" -> Optional.of(FILE_DELETE);
            case "http_request", "http" -> Optional.of(HTTP_REQUEST);
            case "git_operation", "git" -> Optional.of(GIT_OPERATION);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
