package com.riskguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.Data;

/**
 * A raw broker callback relayed over HTTP, e.g. by a broker adapter running out of process.
 */
@Data
public class BrokerEventRequest {

    @NotBlank
    private String type;

    @NotNull
    private Map<String, Object> payload;
}
