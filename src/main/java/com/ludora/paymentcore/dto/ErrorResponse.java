package com.ludora.paymentcore.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/**
 * Unified error response returned by API endpoints.
 */
@Getter
@Setter
@Builder
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final int status;            // HTTP status code
    private final String error;          // Short title (e.g., "Bad Request", "Bad Gateway")
    private final String message;        // Detailed error description
    private final List<String> details;  // Optional: offending intents or coupon codes
    private final String path;           // Request path (optional)
}
