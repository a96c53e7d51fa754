package com.vidnyan.guard.domain.event;

/**
 * A tool call whose candidate is a file path.
 */
public interface PathEvent extends ToolCallEvent {

    String path();

    @Override
    default String candidate() {
        return path();
    }
}
