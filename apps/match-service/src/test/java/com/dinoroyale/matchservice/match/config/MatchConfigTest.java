package com.dinoroyale.matchservice.match.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MatchConfigTest {

    @Test
    void zoneDamageIsFullOutsideTestMode() {
        MatchProperties props = new MatchProperties();

        assertThat(MatchConfig.zoneDamageScale(props)).isEqualTo(1.0);
    }

    @Test
    void testModeReducesZoneDamageToConfiguredShare() {
        MatchProperties props = new MatchProperties();
        props.getTestMode().setEnabled(true);

        assertThat(MatchConfig.zoneDamageScale(props)).isEqualTo(0.25);

        props.getTestMode().setDamageMultiplier(0.5);
        assertThat(MatchConfig.zoneDamageScale(props)).isEqualTo(0.5);
    }
}
