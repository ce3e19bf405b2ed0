package com.tony.cricketLeague.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldingStats {
    private int catches;
    private int runOuts;
    private int stumpings;
}
