package com.vidnyan.guard.domain.event;

import com.vidnyan.guard.domain.rule.ToolKind;

/**
 * One intercepted tool call, typed per tool kind.
 */
public interface ToolCallEvent {

    ToolKind kind();

    /**
     * The string rules are matched against: the command line for exec, the
     * target path for file tools, the URL for HTTP requests.
     */
    String candidate();
}
