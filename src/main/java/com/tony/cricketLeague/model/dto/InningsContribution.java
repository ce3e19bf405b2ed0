package com.tony.cricketLeague.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runs / wickets / balles cumulés sur une ou plusieurs manches d'un même match.
 * Côté batte : runs marqués, wickets perdus, balles jouées. Côté lancer : concédés, pris, lancées.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InningsContribution {
    private int runs;
    private int wickets;
    private int balls;

    public void add(int runs, int wickets, int balls) {
        this.runs += runs;
        this.wickets += wickets;
        this.balls += balls;
    }
}
