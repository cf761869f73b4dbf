package com.demoAuto.salesAgent.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Generates correlation IDs that tie together the log lines of one chat request.
 */
@Service
public class CorrelationIdService {

    public String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
