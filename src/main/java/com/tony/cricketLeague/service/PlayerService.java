package com.tony.cricketLeague.service;

import com.tony.cricketLeague.exception.PlayerConflictException;
import com.tony.cricketLeague.exception.ResourceNotFoundException;
import com.tony.cricketLeague.model.Player;
import com.tony.cricketLeague.model.PlayerField;
import com.tony.cricketLeague.model.UserAccount;
import com.tony.cricketLeague.model.dto.IdentityMatch;
import com.tony.cricketLeague.model.dto.PlayerConflict;
import com.tony.cricketLeague.model.dto.PlayerRequest;
import com.tony.cricketLeague.repository.PlayerRepository;
import com.tony.cricketLeague.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlayerService {

    private final PlayerRepository playerRepository;
    private final UserAccountRepository userAccountRepository;
    private final PlayerIdentityMatcher identityMatcher;

    @Transactional(readOnly = true)
    public Player getPlayer(Long id) {
        return playerRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Player", id));
    }

    /**
     * Création d'un joueur. Une collision d'email n'écrase jamais rien : elle remonte en conflit
     * structuré pour que l'appelant propose la fusion ou un autre email.
     */
    @Transactional
    public Player createPlayer(PlayerRequest request) {
        IdentityMatch identity = identityMatcher.match(request.getEmail(), request.getTeamId(), null);
        if (identity.isCollision()) {
            throw conflict(identity.getExistingPlayer(), request);
        }

        Player player = new Player(request.getName().trim(), normalizeEmail(request.getEmail()));
        applyRequest(player, request);
        Player saved = playerRepository.save(player);
        log.info("➕ Joueur créé : {} (ID {})", saved.getName(), saved.getId());

        linkPlayerToUserByEmail(saved);
        return saved;
    }

    /**
     * Modification partielle : seuls les champs renseignés de la requête sont appliqués.
     */
    @Transactional
    public Player updatePlayer(Long id, PlayerRequest request) {
        Player player = getPlayer(id);

        IdentityMatch identity = identityMatcher.match(request.getEmail(), request.getTeamId(), id);
        if (identity.isCollision()) {
            throw conflict(identity.getExistingPlayer(), request);
        }

        if (PlayerField.isPresent(request.getName())) {
            player.setName(request.getName().trim());
        }
        if (PlayerField.isPresent(request.getEmail())) {
            player.setEmail(normalizeEmail(request.getEmail()));
        }
        applyRequest(player, request);
        Player saved = playerRepository.save(player);

        if (PlayerField.isPresent(request.getEmail())) {
            linkPlayerToUserByEmail(saved);
        }
        return saved;
    }

    /**
     * Lie le joueur au compte utilisateur portant le même email.
     * Au plus un joueur par utilisateur : si un autre joueur est déjà lié, on ne touche à rien.
     */
    @Transactional
    public boolean linkPlayerToUserByEmail(Player player) {
        if (player.getUserId() != null || !PlayerField.isPresent(player.getEmail())) {
            return false;
        }
        Optional<UserAccount> user = userAccountRepository.findByEmailIgnoreCase(player.getEmail().trim());
        if (user.isEmpty()) {
            return false;
        }

        Long userId = user.get().getId();
        Optional<Player> alreadyLinked = playerRepository.findFirstByUserId(userId);
        if (alreadyLinked.isPresent() && !alreadyLinked.get().getId().equals(player.getId())) {
            log.warn("⚠️ Utilisateur {} déjà lié au joueur {}, lien ignoré pour {}",
                    userId, alreadyLinked.get().getId(), player.getId());
            return false;
        }

        player.setUserId(userId);
        playerRepository.save(player);
        log.info("🔗 Joueur {} lié à l'utilisateur {} via l'email {}", player.getId(), userId, player.getEmail());
        return true;
    }

    /** Champs dont les deux valeurs sont renseignées et différentes. */
    public List<String> contestedFields(Player existing, PlayerRequest candidate) {
        return Arrays.stream(PlayerField.values())
                .filter(f -> f.isContested(existing, candidate))
                .map(PlayerField::getKey)
                .toList();
    }

    private PlayerConflictException conflict(Player existing, PlayerRequest candidate) {
        return new PlayerConflictException(
                PlayerConflict.emailExists(existing, candidate, contestedFields(existing, candidate)));
    }

    private void applyRequest(Player player, PlayerRequest request) {
        if (request.getUsername() != null) player.setUsername(request.getUsername());
        if (request.getTeamId() != null) player.setTeamId(request.getTeamId());
        if (request.getTeamName() != null) player.setTeamName(request.getTeamName());
        if (request.getRole() != null) player.setRole(request.getRole());
        if (request.getBattingStyle() != null) player.setBattingStyle(request.getBattingStyle());
        if (request.getBowlingStyle() != null) player.setBowlingStyle(request.getBowlingStyle());
        if (request.getJerseyNumber() != null) player.setJerseyNumber(request.getJerseyNumber());
        if (request.getIsGuest() != null) player.setGuest(request.getIsGuest());
    }

    private static String normalizeEmail(String email) {
        return PlayerField.isPresent(email) ? email.trim().toLowerCase() : null;
    }
}
