package com.tony.cricketLeague.service;

import com.tony.cricketLeague.model.Player;
import com.tony.cricketLeague.model.dto.IdentityMatch;
import com.tony.cricketLeague.repository.PlayerRepository;
import com.tony.cricketLeague.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Détection de collision d'email entre un candidat et les joueurs existants.
 * Égalité exacte insensible à la casse, volontairement sans fuzzy matching. Lecture seule.
 */
@Service
@RequiredArgsConstructor
public class PlayerIdentityMatcher {

    private final PlayerRepository playerRepository;
    private final UserAccountRepository userAccountRepository;

    @Transactional(readOnly = true)
    public IdentityMatch match(String candidateEmail) {
        return match(candidateEmail, null, null);
    }

    /**
     * @param teamId          si renseigné, la collision n'est cherchée que dans cette équipe
     * @param excludePlayerId joueur à ignorer (modification de son propre profil)
     */
    @Transactional(readOnly = true)
    public IdentityMatch match(String candidateEmail, Long teamId, Long excludePlayerId) {
        if (candidateEmail == null || candidateEmail.isBlank()) {
            return IdentityMatch.none();
        }
        String email = candidateEmail.trim();

        // Un joueur déjà lié à un compte est le plus représentatif de l'identité
        Optional<Player> existing = playerRepository.findByEmailIgnoreCaseOrderByIdAsc(email).stream()
                .filter(p -> excludePlayerId == null || !excludePlayerId.equals(p.getId()))
                .filter(p -> teamId == null || Objects.equals(teamId, p.getTeamId()))
                .min(Comparator.comparing((Player p) -> p.getUserId() == null));

        if (existing.isEmpty()) {
            return IdentityMatch.none();
        }

        Player player = existing.get();
        boolean registeredUser = userAccountRepository.findByEmailIgnoreCase(email).isPresent();
        return new IdentityMatch(true, player, registeredUser, player.getUserId() != null);
    }
}
