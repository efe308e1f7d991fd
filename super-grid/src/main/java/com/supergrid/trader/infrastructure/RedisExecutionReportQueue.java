package com.supergrid.trader.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Reads JSON execution reports from a Redis list with a blocking left pop.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisExecutionReportQueue implements ExecutionReportQueue {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String reportQueue;
    private final long popTimeoutSeconds;

    @Override
    public ExecutionReport pop() {
        String payload;
        try {
            payload = redisTemplate.opsForList().leftPop(reportQueue, popTimeoutSeconds, TimeUnit.SECONDS);
        } catch (DataAccessException e) {
            log.error("Redis error while popping from {}: {}", reportQueue, e.getMessage(), e);
            throw new RuntimeException("Failed to read execution report due to Redis error", e);
        }

        if (payload == null) {
            return null;
        }

        try {
            return objectMapper.readValue(payload, ExecutionReport.class);
        } catch (JsonProcessingException e) {
            // a malformed report is dropped, the queue keeps flowing
            log.error("Discarding unreadable execution report {}: {}", payload, e.getOriginalMessage());
            return null;
        }
    }
}
