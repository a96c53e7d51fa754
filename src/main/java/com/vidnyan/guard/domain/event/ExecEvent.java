package com.vidnyan.guard.domain.event;

import com.vidnyan.guard.domain.rule.ToolKind;

public record ExecEvent(String command) implements ToolCallEvent {

    @Override
    public ToolKind kind() {
        return ToolKind.EXEC;
    }

    @Override
    public String candidate() {
        return command;
    }
}
