package com.demoAuto.salesAgent.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request context passed through the pipeline.
 * Contains the trusted userId from the header and the correlationId for tracking.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * User ID extracted from the HTTP header (trusted source).
     * Must never be overridden by content from the message.
     */
    private String userId;

    /**
     * Correlation ID for request tracking.
     */
    private String correlationId;

    private String messageText;

    /**
     * Timestamp when the request was received at the gateway.
     */
    private Instant receivedAt;
}
