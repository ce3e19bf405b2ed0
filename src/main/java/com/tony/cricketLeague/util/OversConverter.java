package com.tony.cricketLeague.util;

import com.tony.cricketLeague.exception.InvalidOversFormatException;

import java.math.BigDecimal;

/**
 * Conversion overs décimaux (notation cricket "4.3" = 4 overs et 3 balles) &lt;-&gt; nombre de balles.
 * Tous les calculs de taux (économie, NRR) passent par les balles, jamais par les décimaux bruts.
 */
public final class OversConverter {

    public static final int BALLS_PER_OVER = 6;

    // Marge d'erreur binaire des doubles (4.3 - 4 = 0.29999999999999982)
    private static final double DIGIT_TOLERANCE = 1e-6;

    private OversConverter() {
    }

    /**
     * 4.3 -> 27, 4.0 -> 24. Un ".0" est légal (over clos sans 6 balles, ex: déclaration).
     *
     * @throws InvalidOversFormatException si la décimale dépasse 6, s'il y a plus d'une décimale ou si la valeur est négative
     */
    public static int oversToBalls(double overs) {
        if (overs < 0 || Double.isNaN(overs) || Double.isInfinite(overs)) {
            throw new InvalidOversFormatException(overs);
        }
        long wholeOvers = (long) Math.floor(overs);
        double ballDigit = (overs - wholeOvers) * 10;
        long remainderBalls = Math.round(ballDigit);
        // Une seule décimale : "4.35" ou "4.04" sont rejetés, jamais arrondis
        if (remainderBalls > BALLS_PER_OVER || Math.abs(ballDigit - remainderBalls) > DIGIT_TOLERANCE) {
            throw new InvalidOversFormatException(overs);
        }
        return Math.toIntExact(wholeOvers * BALLS_PER_OVER + remainderBalls);
    }

    /**
     * Null-safe : une manche sans overs renseignés compte pour 0 balle.
     */
    public static int oversToBalls(Double overs) {
        return overs == null ? 0 : oversToBalls(overs.doubleValue());
    }

    /**
     * 27 -> 4.3. Le reste ne dépasse jamais 5, donc "4.6" ressort normalisé en "5.0".
     */
    public static double ballsToOvers(int balls) {
        if (balls < 0) {
            throw new IllegalArgumentException("Ball count cannot be negative: " + balls);
        }
        // BigDecimal pour obtenir exactement le double le plus proche de "4.3"
        return BigDecimal.valueOf(balls / BALLS_PER_OVER)
                .add(BigDecimal.valueOf(balls % BALLS_PER_OVER, 1))
                .doubleValue();
    }

    /**
     * Addition d'overs au sens cricket : 3.4 + 2.4 = 6.2 (et non 5.8).
     */
    public static double addOvers(double a, double b) {
        return ballsToOvers(oversToBalls(a) + oversToBalls(b));
    }
}
