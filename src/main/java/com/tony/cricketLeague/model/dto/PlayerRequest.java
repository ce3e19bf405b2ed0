package com.tony.cricketLeague.model.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Données candidates d'un joueur (création, modification, ou côté "new" d'un conflit).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerRequest {
    @NotBlank(message = "Le nom du joueur est requis")
    private String name;

    private String username;

    @Email(message = "Email invalide")
    private String email;

    private Long teamId;
    private String teamName;
    private String role;
    private String battingStyle;
    private String bowlingStyle;
    private Integer jerseyNumber;
    private Boolean isGuest;
}
