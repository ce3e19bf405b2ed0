package com.tony.cricketLeague.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Getter @Setter @NoArgsConstructor
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String name;

    private String shortName;

    @Column(nullable = false)
    private String sport = "cricket";

    // Effectif : identifiants des joueurs
    @ElementCollection
    @CollectionTable(name = "team_player", joinColumns = @JoinColumn(name = "team_id"))
    @Column(name = "player_id")
    private List<Long> playerIds = new ArrayList<>();

    @Embedded
    private TeamStats currentStats;

    public Team(String name, String sport) {
        this.name = name;
        this.sport = sport;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
