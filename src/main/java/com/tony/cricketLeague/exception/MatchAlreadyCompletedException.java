package com.tony.cricketLeague.exception;

public class MatchAlreadyCompletedException extends RuntimeException {

    public MatchAlreadyCompletedException(Long matchId) {
        super(String.format("Match %s is already completed", matchId));
    }
}
