package com.vidnyan.guard.domain.event;

import com.vidnyan.guard.domain.rule.ToolKind;

/**
 * In-place edit replacing {@code oldText} with {@code newText}.
 */
public record FileEditEvent(String path, String oldText, String newText) implements PathEvent {

    @Override
    public ToolKind kind() {
        return ToolKind.FILE_EDIT;
    }
}
