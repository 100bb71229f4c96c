package com.pongnet.gameserver.leaderboard;

import com.pongnet.gameserver.user.AppUserRepository;
import com.pongnet.gameserver.user.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class LeaderboardServiceTest {

    @Autowired
    private LeaderboardService leaderboardService;

    @Autowired
    private UserService userService;

    @Autowired
    private AppUserRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    void ranksByWinsThenRegistrationOrder() {
        userService.register("carol", "pw");
        userService.register("dave", "pw");
        userService.register("erin", "pw");
        leaderboardService.recordWin("erin");
        leaderboardService.recordWin("erin");
        leaderboardService.recordWin("dave");
        leaderboardService.recordWin("carol");

        List<LeaderboardEntry> top = leaderboardService.topN(10);

        assertThat(top).containsExactly(
                new LeaderboardEntry(1, "erin", 2),
                new LeaderboardEntry(2, "carol", 1),
                new LeaderboardEntry(3, "dave", 1));
    }

    @Test
    void topNIsCappedAndIncludesPlayersWithoutWins() {
        userService.register("frank", "pw");
        userService.register("grace", "pw");
        userService.register("heidi", "pw");
        leaderboardService.recordWin("heidi");

        assertThat(leaderboardService.topN(2)).extracting(LeaderboardEntry::username)
                .containsExactly("heidi", "frank");
        assertThat(leaderboardService.topN(0)).isEmpty();
    }

    @Test
    void winsAccumulate() {
        userService.register("ivan", "pw");
        for (int i = 0; i < 3; i++) {
            leaderboardService.recordWin("ivan");
        }

        assertThat(repository.findByUsername("ivan").orElseThrow().getWinCount()).isEqualTo(3);
    }

    @Test
    void recordingAWinForAnUnknownUserFails() {
        assertThatThrownBy(() -> leaderboardService.recordWin("nobody"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
