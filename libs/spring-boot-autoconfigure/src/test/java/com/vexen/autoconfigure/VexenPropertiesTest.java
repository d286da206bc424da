package com.vexen.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import com.vexen.authentication.SigningAlgorithm;
import com.vexen.core.VexenConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VexenProperties")
class VexenPropertiesTest {

    @Test
    @DisplayName("defaults unset optional fields")
    void defaults() {
        var props = new VexenProperties("jdbc:h2:mem:props", "secret", null, false, null, null, null, null);

        assertThat(props.toConfig()).isEqualTo(new VexenConfig("jdbc:h2:mem:props", "secret"));
    }

    @Test
    @DisplayName("keeps explicit values, including a zero overflow")
    void explicitValues() {
        var props = new VexenProperties("jdbc:h2:mem:props", "secret", SigningAlgorithm.HS384, true, 3, 0, 10, 7);

        VexenConfig config = props.toConfig();
        assertThat(config.algorithm()).isEqualTo(SigningAlgorithm.HS384);
        assertThat(config.echo()).isTrue();
        assertThat(config.poolSize()).isEqualTo(3);
        assertThat(config.maxOverflow()).isZero();
        assertThat(config.accessTokenExpiresMinutes()).isEqualTo(10);
        assertThat(config.refreshTokenExpiresDays()).isEqualTo(7);
    }

    @Test
    @DisplayName("toString() masks the secret key")
    void masksSecret() {
        var props = new VexenProperties("jdbc:h2:mem:props", "do-not-log", null, false, null, null, null, null);

        assertThat(props.toString()).doesNotContain("do-not-log");
    }
}
