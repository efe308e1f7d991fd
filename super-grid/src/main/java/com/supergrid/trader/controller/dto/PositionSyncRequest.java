package com.supergrid.trader.controller.dto;

import com.supergrid.trader.domain.PositionSync;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for a venue position report. The volume may be negative for a
 * net short position.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionSyncRequest {

    @NotNull(message = "Volume is required")
    private BigDecimal volume;

    private BigDecimal price;

    public PositionSync toPositionSync() {
        return PositionSync.builder()
                .volume(volume)
                .price(price)
                .build();
    }
}
