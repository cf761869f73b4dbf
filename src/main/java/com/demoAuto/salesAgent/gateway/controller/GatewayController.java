package com.demoAuto.salesAgent.gateway.controller;

import com.demoAuto.salesAgent.gateway.dto.ChatRequest;
import com.demoAuto.salesAgent.gateway.dto.ChatResponse;
import com.demoAuto.salesAgent.gateway.service.ChatGatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Gateway REST controller - thin HTTP layer for chat requests.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract the X-User-ID header
 * - Delegate business logic to ChatGatewayService
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class GatewayController {

    static final String USER_ID_HEADER = "X-User-ID";

    private final ChatGatewayService chatGatewayService;

    /**
     * Chat endpoint - one customer message in, one reply out.
     *
     * @param request      Chat request containing the message
     * @param userIdHeader User ID from HTTP header (trusted)
     * @return Chat response with answer, intent and any cars or financing plan
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {

        return ResponseEntity.ok(chatGatewayService.processChatRequest(request, userIdHeader));
    }

    /**
     * Clears the conversation history for the user.
     */
    @PostMapping("/reset")
    public ResponseEntity<Map<String, String>> reset(
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {

        chatGatewayService.resetConversation(userIdHeader);
        return ResponseEntity.ok(Map.of("status", "success", "message", "Conversation reset"));
    }
}
