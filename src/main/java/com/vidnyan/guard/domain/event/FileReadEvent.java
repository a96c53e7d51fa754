package com.vidnyan.guard.domain.event;

import com.vidnyan.guard.domain.rule.ToolKind;

public record FileReadEvent(String path) implements PathEvent {

    @Override
    public ToolKind kind() {
        return ToolKind.FILE_READ;
    }
}
