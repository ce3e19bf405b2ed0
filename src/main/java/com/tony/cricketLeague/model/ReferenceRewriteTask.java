package com.tony.cricketLeague.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Entrée durable de la file de réparation : "réécriture ancien joueur -> nouveau joueur en attente".
 * Créée quand une fusion n'a pas pu mettre à jour toutes les collections dépendantes.
 */
@Entity
@Getter @Setter @NoArgsConstructor
public class ReferenceRewriteTask {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long oldPlayerId;

    @Column(nullable = false)
    private Long newPlayerId;

    @Enumerated(EnumType.STRING)
    private RewriteTaskStatus status = RewriteTaskStatus.PENDING;

    // Le joueur source n'est supprimé qu'une fois ses performances réattribuées
    private boolean sourceDeletionPending;

    // Carrières additionnées à la fusion : à recalculer une fois les performances rattachées
    private boolean careerRebuildPending;

    @Column(length = 1024)
    private String failedCollections;

    @Column(length = 2048)
    private String lastError;

    private int attempts;

    private Instant createdAt;
    private Instant updatedAt;

    public ReferenceRewriteTask(Long oldPlayerId, Long newPlayerId) {
        this.oldPlayerId = oldPlayerId;
        this.newPlayerId = newPlayerId;
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
}
