package com.lynkvertx.tbce.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TierResultTest {

    @Test
    void envelopeSumsReactionsAndWeightButTakesMaximaOfMomentAndDeflection() {
        TierResult upper = new TierResult(new SupportReactions(1000, 1500), 2.0e6, 3.5, 254.5);
        TierResult lower = new TierResult(new SupportReactions(400, 200), 3.0e6, 1.2, 61.25);

        TierResult total = TierResult.EMPTY.envelope(upper).envelope(lower);

        assertThat(total.getReactions()).isEqualTo(new SupportReactions(1400, 1700));
        assertThat(total.getMaxMomentNmm()).isEqualTo(3.0e6);
        assertThat(total.getMaxMomentKNm()).isEqualTo(3.0);
        assertThat(total.getMaxDeflectionMm()).isEqualTo(3.5);
        assertThat(total.getWeightKg()).isEqualTo(315.75);
        assertThat(total.getReactions().governingN()).isEqualTo(1700);
    }
}
