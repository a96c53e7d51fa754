package com.vidnyan.guard.domain.event;

import com.vidnyan.guard.domain.rule.ToolKind;

/**
 * Whole-file write. {@code content} may be null when the host omits it.
 */
public record FileWriteEvent(String path, String content) implements PathEvent {

    @Override
    public ToolKind kind() {
        return ToolKind.FILE_WRITE;
    }
}
