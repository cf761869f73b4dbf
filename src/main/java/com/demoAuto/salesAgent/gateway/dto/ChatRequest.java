package com.demoAuto.salesAgent.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for chat messages.
 * Contains only the message text - userId comes from the HTTP header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "message cannot be blank")
    @Size(max = 2000, message = "message cannot exceed 2000 characters")
    private String message;
}
