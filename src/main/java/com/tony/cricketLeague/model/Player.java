package com.tony.cricketLeague.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(indexes = @Index(name = "idx_player_email", columnList = "email"))
public class Player {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Verrou optimiste : deux clôtures de match concurrentes ne doivent pas s'écraser
    @Version
    private Long version;

    @Column(nullable = false)
    private String name;

    private String username;

    // Clé d'identité (optionnelle). Pas de contrainte d'unicité : un joueur peut exister non lié
    private String email;

    // Compte utilisateur lié (au plus un joueur par utilisateur, contrôlé au moment du lien/fusion)
    private Long userId;

    private Long teamId;
    private String teamName;

    private String role;          // batsman, bowler, all-rounder, wicket-keeper
    private String battingStyle;  // right-handed, left-handed
    private String bowlingStyle;  // right-arm-fast, leg-spin...
    private Integer jerseyNumber;

    @JsonProperty("isGuest")
    private boolean guest;

    @Embedded
    private CareerStats careerStats = CareerStats.empty();

    // --- Métadonnées de fusion ---
    @ElementCollection
    @CollectionTable(name = "player_merged_from", joinColumns = @JoinColumn(name = "player_id"))
    @Column(name = "source_player_id")
    private List<Long> mergedFromPlayerIds = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "player_merge_history", joinColumns = @JoinColumn(name = "player_id"))
    private List<MergeHistoryEntry> mergeHistory = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public Player(String name, String email) {
        this.name = name;
        this.email = email;
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public CareerStats getCareerStats() {
        // Les lignes anciennes peuvent revenir sans agrégat
        if (careerStats == null) {
            careerStats = CareerStats.empty();
        }
        return careerStats;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player)) return false;
        return id != null && id.equals(((Player) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
