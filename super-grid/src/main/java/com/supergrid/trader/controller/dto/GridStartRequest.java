package com.supergrid.trader.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for starting a grid. Settings use the grid's option names,
 * e.g. {@code lower_price} or {@code rise_percent}; missing ones take defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridStartRequest {

    @NotNull(message = "Settings are required")
    private Map<String, Object> settings;
}
