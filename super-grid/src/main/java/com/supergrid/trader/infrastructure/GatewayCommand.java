package com.supergrid.trader.infrastructure;

import com.supergrid.trader.domain.Direction;
import com.supergrid.trader.domain.Offset;
import com.supergrid.trader.domain.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Instruction published to the external executor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GatewayCommand {

    private CommandType type;
    private String orderId;
    private String symbol;
    private Direction direction;
    private Offset offset;
    private OrderType orderType;
    private BigDecimal price;
    private BigDecimal volume;
    private long timestamp;

    public enum CommandType {
        NEW_ORDER, CANCEL_ALL
    }
}
