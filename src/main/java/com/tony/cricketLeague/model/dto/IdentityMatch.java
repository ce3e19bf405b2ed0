package com.tony.cricketLeague.model.dto;

import com.tony.cricketLeague.model.Player;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class IdentityMatch {
    private boolean collision;
    private Player existingPlayer;
    // L'email appartient à un compte utilisateur enregistré
    private boolean registeredUser;
    // Le joueur existant est déjà lié à un compte (player.userId renseigné)
    private boolean linkedToUser;

    public static IdentityMatch none() {
        return new IdentityMatch(false, null, false, false);
    }
}
