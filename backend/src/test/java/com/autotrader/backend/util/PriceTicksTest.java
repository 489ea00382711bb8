package com.autotrader.backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriceTicksTest {

    @Test
    void stopsRoundDownToTheTick() {
        assertThat(PriceTicks.roundDown(48.037, 0.01)).isEqualTo(48.03);
        assertThat(PriceTicks.roundDown(10.07, 0.05)).isEqualTo(10.05);
    }

    @Test
    void takeProfitsRoundUpToTheTick() {
        assertThat(PriceTicks.roundUp(52.031, 0.01)).isEqualTo(52.04);
        assertThat(PriceTicks.roundUp(10.01, 0.05)).isEqualTo(10.05);
    }

    @Test
    void alignedPricesAreUnchanged() {
        assertThat(PriceTicks.roundDown(12.35, 0.05)).isEqualTo(12.35);
        assertThat(PriceTicks.roundUp(12.35, 0.05)).isEqualTo(12.35);
    }

    @Test
    void nonPositiveTickLeavesPriceAlone() {
        assertThat(PriceTicks.roundDown(12.3456, 0.0)).isEqualTo(12.3456);
    }
}
