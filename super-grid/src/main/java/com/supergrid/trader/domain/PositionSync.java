package com.supergrid.trader.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Authoritative position reported by the venue, with its average price.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionSync {

    private BigDecimal volume;
    private BigDecimal price;
}
