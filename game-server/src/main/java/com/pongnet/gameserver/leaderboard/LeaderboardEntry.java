package com.pongnet.gameserver.leaderboard;

public record LeaderboardEntry(int rank, String username, int wins) {
}
