package com.supergrid.trader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supergrid.trader.domain.OrderGateway;
import com.supergrid.trader.infrastructure.ExecutionReportQueue;
import com.supergrid.trader.infrastructure.PaperOrderGateway;
import com.supergrid.trader.infrastructure.RedisExecutionReportQueue;
import com.supergrid.trader.infrastructure.RedisOrderGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the order gateway. {@code grid.gateway.mode=backtest} (the
 * default) matches orders in memory; {@code live} routes them over Redis
 * queues to an external execution adapter.
 */
@Configuration
public class GatewayConfig {

    @Value("${grid.gateway.redis.order-queue:grid-orders}")
    private String orderQueue;

    @Value("${grid.gateway.redis.report-queue:grid-executions}")
    private String reportQueue;

    @Value("${grid.worker.poll-timeout-seconds:1}")
    private long pollTimeoutSeconds;

    @Bean
    @ConditionalOnProperty(name = "grid.gateway.mode", havingValue = "backtest", matchIfMissing = true)
    public OrderGateway paperOrderGateway() {
        return new PaperOrderGateway();
    }

    @Bean
    @ConditionalOnProperty(name = "grid.gateway.mode", havingValue = "live")
    public OrderGateway redisOrderGateway(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisOrderGateway(redisTemplate, objectMapper, orderQueue);
    }

    @Bean
    @ConditionalOnProperty(name = "grid.gateway.mode", havingValue = "live")
    public ExecutionReportQueue executionReportQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisExecutionReportQueue(redisTemplate, objectMapper, reportQueue, pollTimeoutSeconds);
    }
}
