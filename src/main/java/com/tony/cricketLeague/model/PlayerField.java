package com.tony.cricketLeague.model;

import com.tony.cricketLeague.model.dto.PlayerRequest;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Champs d'un joueur arbitrables lors d'un conflit / d'une fusion.
 * L'email et l'id n'en font pas partie : ils ne sont jamais écrasés.
 */
public enum PlayerField {
    NAME("name", Player::getName, PlayerRequest::getName, (p, v) -> p.setName((String) v)),
    USERNAME("username", Player::getUsername, PlayerRequest::getUsername, (p, v) -> p.setUsername((String) v)),
    TEAM_NAME("teamName", Player::getTeamName, PlayerRequest::getTeamName, (p, v) -> p.setTeamName((String) v)),
    ROLE("role", Player::getRole, PlayerRequest::getRole, (p, v) -> p.setRole((String) v)),
    BATTING_STYLE("battingStyle", Player::getBattingStyle, PlayerRequest::getBattingStyle, (p, v) -> p.setBattingStyle((String) v)),
    BOWLING_STYLE("bowlingStyle", Player::getBowlingStyle, PlayerRequest::getBowlingStyle, (p, v) -> p.setBowlingStyle((String) v)),
    JERSEY_NUMBER("jerseyNumber", Player::getJerseyNumber, PlayerRequest::getJerseyNumber, (p, v) -> p.setJerseyNumber((Integer) v));

    private final String key;
    private final Function<Player, Object> existingValue;
    private final Function<PlayerRequest, Object> candidateValue;
    private final BiConsumer<Player, Object> writer;

    PlayerField(String key, Function<Player, Object> existingValue,
                Function<PlayerRequest, Object> candidateValue, BiConsumer<Player, Object> writer) {
        this.key = key;
        this.existingValue = existingValue;
        this.candidateValue = candidateValue;
        this.writer = writer;
    }

    public String getKey() {
        return key;
    }

    public Object existing(Player player) {
        return existingValue.apply(player);
    }

    public Object candidate(PlayerRequest request) {
        return candidateValue.apply(request);
    }

    public void write(Player player, Object value) {
        writer.accept(player, value);
    }

    /** Valeurs différentes et toutes deux renseignées : l'utilisateur doit choisir. */
    public boolean isContested(Player player, PlayerRequest request) {
        Object current = existing(player);
        Object incoming = candidate(request);
        return isPresent(current) && isPresent(incoming) && !current.equals(incoming);
    }

    /** Valeur absente côté existant, fournie par le candidat. */
    public boolean fillsGap(Player player, PlayerRequest request) {
        return !isPresent(existing(player)) && isPresent(candidate(request));
    }

    public static boolean isPresent(Object value) {
        if (value == null) return false;
        if (value instanceof String) return !((String) value).isBlank();
        return true;
    }
}
