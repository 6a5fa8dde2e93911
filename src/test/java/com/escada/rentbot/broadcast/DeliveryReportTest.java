package com.escada.rentbot.broadcast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeliveryReportTest {

    @Test
    void shouldComputeSuccessRatioOverProcessed() {
        DeliveryReport r = new DeliveryReport(2, 1, 0);

        assertThat(r.processed()).isEqualTo(3);
        assertThat(r.successRatio()).isCloseTo(0.6667, within(0.0001));
    }

    @Test
    void shouldExposeCountsForStatsJson() {
        assertThat(new DeliveryReport(3, 1, 1).toMap())
                .containsEntry("sent", 3)
                .containsEntry("blocked", 1)
                .containsEntry("failed", 1)
                .containsKey("success_ratio");
    }
}
