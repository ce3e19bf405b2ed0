package com.tony.cricketLeague.exception;

/**
 * Valeur d'overs décimale mal formée (ex: 4.7). La manche concernée est rejetée, jamais tronquée.
 */
public class InvalidOversFormatException extends IllegalArgumentException {

    private final double overs;

    public InvalidOversFormatException(double overs) {
        super(String.format("Invalid overs value %s: the decimal digit counts balls and must be between 0 and 6", overs));
        this.overs = overs;
    }

    public double getOvers() {
        return overs;
    }
}
