package com.lexinsight.llmjob.service.llm;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Estimates provider cost from token usage.
 * Amounts are USD millionths, so a per-million-token price is the micro-USD price of one token.
 */
public final class TokenCostEstimator {

    record ModelPricing(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
    }

    private static final Map<String, ModelPricing> PRICING_BY_MODEL = Map.of(
            "gpt-5", new ModelPricing(new BigDecimal("1.25"), new BigDecimal("10.0")),
            "gpt-5-mini", new ModelPricing(new BigDecimal("0.25"), new BigDecimal("2.0")),
            "gpt-5-nano", new ModelPricing(new BigDecimal("0.05"), new BigDecimal("0.4"))
    );

    // 티어별 가격 차이가 공개되기 전까지 1.0
    private static final Map<String, BigDecimal> SERVICE_TIER_MULTIPLIER = Map.of(
            "flex", BigDecimal.ONE,
            "default", BigDecimal.ONE,
            "priority", BigDecimal.ONE
    );

    private TokenCostEstimator() {
    }

    /**
     * @return estimated cost in USD millionths, or null when the model has no known pricing
     */
    public static Long estimateMicrounits(String model, String serviceTier, long inputTokens, long outputTokens) {
        ModelPricing pricing = model != null ? PRICING_BY_MODEL.get(model) : null;
        if (pricing == null) {
            return null;
        }
        BigDecimal multiplier = serviceTier != null
                ? SERVICE_TIER_MULTIPLIER.getOrDefault(serviceTier, BigDecimal.ONE)
                : BigDecimal.ONE;

        BigDecimal input = pricing.inputPerMillion().multiply(BigDecimal.valueOf(inputTokens));
        BigDecimal output = pricing.outputPerMillion().multiply(BigDecimal.valueOf(outputTokens));
        return input.add(output)
                .multiply(multiplier)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
