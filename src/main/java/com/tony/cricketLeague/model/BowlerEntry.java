package com.tony.cricketLeague.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BowlerEntry {
    private Long playerId;
    private Double overs;
    private Integer maidens;
    private Integer runsGiven;
    private Integer wickets;
}
