package com.lexinsight.llmjob.service.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TokenCostEstimator 단위 테스트
 */
class TokenCostEstimatorTest {

    @Test
    @DisplayName("gpt-5-nano: 입력 1M 토큰 0.05 USD, 출력 1M 토큰 0.4 USD")
    void estimatesNanoPricing() {
        Long cost = TokenCostEstimator.estimateMicrounits("gpt-5-nano", null, 1_000_000, 1_000_000);

        assertThat(cost).isEqualTo(450_000L);
    }

    @Test
    @DisplayName("gpt-5: 소량 토큰도 마이크로 단위로 반올림")
    void estimatesSmallUsage() {
        // 1200 * 1.25 + 300 * 10.0 = 1500 + 3000
        Long cost = TokenCostEstimator.estimateMicrounits("gpt-5", "flex", 1200, 300);

        assertThat(cost).isEqualTo(4500L);
    }

    @Test
    @DisplayName("가격표에 없는 모델은 null")
    void unknownModel_returnsNull() {
        assertThat(TokenCostEstimator.estimateMicrounits("gpt-4o", "default", 1000, 1000)).isNull();
        assertThat(TokenCostEstimator.estimateMicrounits(null, null, 1000, 1000)).isNull();
    }

    @Test
    @DisplayName("토큰 사용량이 없으면 0")
    void zeroUsage() {
        assertThat(TokenCostEstimator.estimateMicrounits("gpt-5-mini", "priority", 0, 0)).isZero();
    }
}
