package com.lexinsight.llmjob.service.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ChainDecision 단위 테스트
 */
class ChainDecisionTest {

    @Test
    @DisplayName("남은 항목이 있고 최대 깊이 미만이면 다음 깊이로 체인")
    void chainsWhenPendingAndBelowMaxDepth() {
        ChainDecision decision = ChainDecision.decide(500, 0, 2);

        assertThat(decision.chain()).isTrue();
        assertThat(decision.nextDepth()).isEqualTo(1);
    }

    @Test
    @DisplayName("최대 깊이에 도달하면 체인하지 않음")
    void stopsAtMaxDepth() {
        ChainDecision decision = ChainDecision.decide(500, 2, 2);

        assertThat(decision.chain()).isFalse();
        assertThat(decision.reason()).contains("Max chain depth");
    }

    @Test
    @DisplayName("남은 항목이 없으면 체인하지 않음")
    void stopsWhenNothingPending() {
        ChainDecision decision = ChainDecision.decide(0, 0, 2);

        assertThat(decision.chain()).isFalse();
        assertThat(decision.reason()).isEqualTo("No pending items remaining");
    }
}
