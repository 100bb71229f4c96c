package com.pongnet.gameserver.web.dto;

import com.pongnet.gameserver.leaderboard.LeaderboardEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntryDto {

    private int rank;
    private String username;
    private int wins;

    public static LeaderboardEntryDto from(LeaderboardEntry entry) {
        return new LeaderboardEntryDto(entry.rank(), entry.username(), entry.wins());
    }
}
