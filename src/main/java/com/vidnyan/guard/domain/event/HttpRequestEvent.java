package com.vidnyan.guard.domain.event;

import com.vidnyan.guard.domain.rule.ToolKind;

public record HttpRequestEvent(String url) implements ToolCallEvent {

    @Override
    public ToolKind kind() {
        return ToolKind.HTTP_REQUEST;
    }

    @Override
    public String candidate() {
        return url;
    }
}
