package com.supergrid.trader.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supergrid.trader.domain.Deadline;
import com.supergrid.trader.domain.GridConfig;
import com.supergrid.trader.domain.GridConfigurationException;
import com.supergrid.trader.domain.OrderType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link GridConfig} from a settings map keyed by the grid's option
 * names. Missing options take the defaults; malformed ones are rejected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GridConfigFactory {

    static final Set<String> RECOGNIZED_OPTIONS = Set.of(
            "vt_symbol", "lower_price", "upper_price", "trigger_price",
            "rise_percent", "fall_down", "fall_percent", "rise_up",
            "order_type", "order_volume", "order_amount",
            "max_position", "min_position", "multiple_order", "deadline",
            "give_up_bias", "buy_offset", "sell_offset");

    private final ObjectMapper objectMapper;

    /**
     * Create and validate a grid config.
     *
     * @throws GridConfigurationException if an option is malformed or the
     *                                    resulting config is inconsistent
     */
    public GridConfig createConfig(Map<String, Object> settings) {
        log.info("Creating grid config from settings: {}", settings);

        JsonNode params = objectMapper.valueToTree(settings == null ? Map.of() : settings);
        Iterator<String> names = params.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!RECOGNIZED_OPTIONS.contains(name)) {
                log.warn("Ignoring unknown grid option: {}", name);
            }
        }

        GridConfig defaults = GridConfig.builder().build();

        GridConfig config = GridConfig.builder()
                .vtSymbol(text(params, "vt_symbol", defaults.getVtSymbol()))
                .lowerPrice(decimal(params, "lower_price", defaults.getLowerPrice()))
                .upperPrice(decimal(params, "upper_price", defaults.getUpperPrice()))
                .triggerPrice(decimal(params, "trigger_price", defaults.getTriggerPrice()))
                .risePercent(decimal(params, "rise_percent", defaults.getRisePercent()))
                .fallDown(decimal(params, "fall_down", defaults.getFallDown()))
                .fallPercent(decimal(params, "fall_percent", defaults.getFallPercent()))
                .riseUp(decimal(params, "rise_up", defaults.getRiseUp()))
                .orderType(orderType(params, defaults.getOrderType()))
                .orderVolume(decimal(params, "order_volume", defaults.getOrderVolume()))
                .orderAmount(decimal(params, "order_amount", defaults.getOrderAmount()))
                .maxPosition(decimal(params, "max_position", defaults.getMaxPosition()))
                .minPosition(decimal(params, "min_position", defaults.getMinPosition()))
                .multipleOrder(bool(params, "multiple_order", defaults.isMultipleOrder()))
                .deadline(params.hasNonNull("deadline")
                        ? Deadline.parse(params.get("deadline").asText())
                        : defaults.getDeadline())
                .giveUpBias(decimal(params, "give_up_bias", defaults.getGiveUpBias()))
                .buyOffset(decimal(params, "buy_offset", defaults.getBuyOffset()))
                .sellOffset(decimal(params, "sell_offset", defaults.getSellOffset()))
                .build();

        config.validate();
        return config;
    }

    private static String text(JsonNode params, String name, String fallback) {
        return params.hasNonNull(name) ? params.get(name).asText() : fallback;
    }

    private static BigDecimal decimal(JsonNode params, String name, BigDecimal fallback) {
        if (!params.hasNonNull(name)) {
            return fallback;
        }
        JsonNode node = params.get(name);
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new GridConfigurationException(name + " is not a number: " + node.asText());
        }
    }

    private static boolean bool(JsonNode params, String name, boolean fallback) {
        if (!params.hasNonNull(name)) {
            return fallback;
        }
        JsonNode node = params.get(name);
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String value = node.asText().trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new GridConfigurationException(name + " is not a boolean: " + node.asText());
        };
    }

    private static OrderType orderType(JsonNode params, OrderType fallback) {
        if (!params.hasNonNull("order_type")) {
            return fallback;
        }
        String value = params.get("order_type").asText().trim().toUpperCase(Locale.ROOT);
        try {
            return OrderType.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new GridConfigurationException("order_type must be LIMIT or MARKET, got " + value);
        }
    }
}
