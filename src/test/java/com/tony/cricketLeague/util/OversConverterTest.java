package com.tony.cricketLeague.util;

import com.tony.cricketLeague.exception.InvalidOversFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OversConverterTest {

    @Test
    @DisplayName("4.3 overs = 27 balles, 4.0 overs = 24 balles")
    void shouldConvertOversToBalls() {
        assertThat(OversConverter.oversToBalls(4.3)).isEqualTo(27);
        assertThat(OversConverter.oversToBalls(4.0)).isEqualTo(24);
        assertThat(OversConverter.oversToBalls(0.0)).isZero();
        assertThat(OversConverter.oversToBalls(20.0)).isEqualTo(120);
    }

    @Test
    @DisplayName("Un .6 est accepté (over complet noté à l'ancienne)")
    void sixthBallIsAccepted() {
        assertThat(OversConverter.oversToBalls(4.6)).isEqualTo(30);
        // Normalisé à la sortie
        assertThat(OversConverter.ballsToOvers(30)).isEqualTo(5.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.1, 0.5, 3.4, 4.3, 9.5, 19.2, 49.5, 120.0})
    @DisplayName("Aller-retour stable pour les décimales 0 à 5")
    void roundTripShouldBeStable(double overs) {
        assertThat(OversConverter.ballsToOvers(OversConverter.oversToBalls(overs))).isEqualTo(overs);
    }

    @Test
    @DisplayName("Une décimale > 6 est rejetée, jamais tronquée")
    void shouldRejectInvalidBallDigit() {
        assertThatThrownBy(() -> OversConverter.oversToBalls(4.7))
                .isInstanceOf(InvalidOversFormatException.class)
                .hasMessageContaining("4.7");
        assertThatThrownBy(() -> OversConverter.oversToBalls(-1.0))
                .isInstanceOf(InvalidOversFormatException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {4.35, 4.04, 4.64, 0.01, 19.55})
    @DisplayName("Une deuxième décimale est rejetée, jamais arrondie")
    void shouldRejectSecondDecimalDigit(double overs) {
        assertThatThrownBy(() -> OversConverter.oversToBalls(overs))
                .isInstanceOf(InvalidOversFormatException.class);
    }

    @Test
    void nullOversCountAsZeroBalls() {
        assertThat(OversConverter.oversToBalls((Double) null)).isZero();
    }

    @Test
    @DisplayName("3.4 + 2.4 = 6.2 (addition en balles)")
    void shouldAddOversBallAccurately() {
        assertThat(OversConverter.addOvers(3.4, 2.4)).isEqualTo(6.2);
        assertThat(OversConverter.ballsToOvers(27)).isEqualTo(4.3);
    }
}
