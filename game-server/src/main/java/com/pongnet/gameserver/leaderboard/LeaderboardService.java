package com.pongnet.gameserver.leaderboard;

import com.pongnet.gameserver.user.AppUser;
import com.pongnet.gameserver.user.AppUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Win counts per registered user. Ties are ordered by registration order.
 */
@Service
public class LeaderboardService {
    private static final Logger log = LoggerFactory.getLogger(LeaderboardService.class);

    private final AppUserRepository repository;

    public LeaderboardService(AppUserRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public void recordWin(String username) {
        int updated = repository.incrementWinCount(username);
        if (updated == 0) {
            throw new IllegalArgumentException("No such user: " + username);
        }
        log.info("Recorded win for {}", username);
    }

    @Transactional(readOnly = true)
    public List<LeaderboardEntry> topN(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<AppUser> users = repository.findAllByOrderByWinCountDescIdAsc(PageRequest.of(0, n));
        List<LeaderboardEntry> entries = new ArrayList<>(users.size());
        int rank = 1;
        for (AppUser user : users) {
            entries.add(new LeaderboardEntry(rank++, user.getUsername(), user.getWinCount()));
        }
        return entries;
    }
}
