package com.tony.cricketLeague.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResultSummary {
    @Enumerated(EnumType.STRING)
    private ResultType resultType;

    private Long winnerId;

    // Ex: "Red won by 10 runs"
    @Column(length = 512)
    private String description;

    public ResultSummary(ResultType resultType, Long winnerId) {
        this.resultType = resultType;
        this.winnerId = winnerId;
    }
}
