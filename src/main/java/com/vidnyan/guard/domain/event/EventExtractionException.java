package com.vidnyan.guard.domain.event;

/**
 * The host's tool call could not be turned into a typed event: the tool is not
 * one the guard recognizes, or the candidate string is missing.
 */
public class EventExtractionException extends Exception {

    private final String toolName;

    public EventExtractionException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
