package com.vidnyan.guard.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.guard.application.port.in.GuardToolCallUseCase;
import com.vidnyan.guard.application.port.in.GuardToolCallUseCase.GuardStatus;
import com.vidnyan.guard.application.port.in.GuardToolCallUseCase.HookRequest;
import com.vidnyan.guard.application.port.in.GuardToolCallUseCase.HookResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Endpoint for the host's before-tool-call hook.
 */
@Slf4j
@RestController
@RequestMapping("/api/hook")
@RequiredArgsConstructor
public class HookController {

    private final GuardToolCallUseCase guardToolCallUseCase;

    @PostMapping("/before-tool-call")
    public BeforeToolCallResponse beforeToolCall(@RequestBody BeforeToolCallRequest request) {
        log.debug("Hook call: tool={}", request.toolName());
        HookResponse response = guardToolCallUseCase.beforeToolCall(
                new HookRequest(request.toolName(), request.params()));
        return new BeforeToolCallResponse(response.block(), response.blockReason());
    }

    @GetMapping("/status")
    public GuardStatus status() {
        return guardToolCallUseCase.status();
    }

    public record BeforeToolCallRequest(
        @JsonProperty("tool_name") @JsonAlias("toolName") String toolName,
        Map<String, Object> params
    ) {}

    public record BeforeToolCallResponse(
        boolean block,
        @JsonProperty("block_reason") String blockReason
    ) {}
}
