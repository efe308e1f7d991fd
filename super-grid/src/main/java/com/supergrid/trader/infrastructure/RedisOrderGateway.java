package com.supergrid.trader.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supergrid.trader.domain.GatewayMode;
import com.supergrid.trader.domain.OrderGateway;
import com.supergrid.trader.domain.OrderIntent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.UUID;

/**
 * Live gateway: publishes order and cancel commands as JSON onto a Redis
 * list consumed by an external executor. Executions come back through
 * {@link ExecutionReportWorker}.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisOrderGateway implements OrderGateway {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String orderQueue;

    @Override
    public GatewayMode mode() {
        return GatewayMode.LIVE;
    }

    @Override
    public String sendOrder(OrderIntent intent) {
        if (intent == null) {
            throw new IllegalArgumentException("Order intent cannot be null");
        }

        String orderId = UUID.randomUUID().toString();
        push(GatewayCommand.builder()
                .type(GatewayCommand.CommandType.NEW_ORDER)
                .orderId(orderId)
                .symbol(intent.getSymbol())
                .direction(intent.getDirection())
                .offset(intent.getOffset())
                .orderType(intent.getOrderType())
                .price(intent.getPrice())
                .volume(intent.getVolume())
                .timestamp(System.currentTimeMillis())
                .build());
        return orderId;
    }

    @Override
    public void cancelAll(String symbol) {
        push(GatewayCommand.builder()
                .type(GatewayCommand.CommandType.CANCEL_ALL)
                .symbol(symbol)
                .timestamp(System.currentTimeMillis())
                .build());
    }

    private void push(GatewayCommand command) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} command: {}", command.getType(), e.getMessage(), e);
            throw new RuntimeException("Failed to serialize gateway command", e);
        }

        try {
            Long queueSize = redisTemplate.opsForList().rightPush(orderQueue, payload);
            log.info("Pushed {} command {} to Redis queue {} (size {})",
                    command.getType(), command.getOrderId(), orderQueue, queueSize);
        } catch (DataAccessException e) {
            log.error("Redis error while pushing {} command: {}", command.getType(), e.getMessage(), e);
            throw new RuntimeException("Failed to publish gateway command due to Redis error", e);
        }
    }
}
