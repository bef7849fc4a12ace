package org.gc.relaymonitor.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {

    private boolean ok;
    private String message;
    private Map<String, Object> details;

    public static StatusResponse success(String message, Map<String, Object> details) {
        return StatusResponse.builder()
                .ok(true)
                .message(message)
                .details(details)
                .build();
    }

    public static StatusResponse failure(String message) {
        return StatusResponse.builder()
                .ok(false)
                .message(message)
                .build();
    }
}
