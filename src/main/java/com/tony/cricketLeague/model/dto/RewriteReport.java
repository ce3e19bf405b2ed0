package com.tony.cricketLeague.model.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bilan d'une réécriture de références ancien joueur -> nouveau joueur, collection par collection.
 */
@Data
public class RewriteReport {
    private final Long oldPlayerId;
    private final Long newPlayerId;
    private final List<String> collectionsUpdated = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public boolean hasFailed(String collection) {
        return failures.containsKey(collection);
    }
}
