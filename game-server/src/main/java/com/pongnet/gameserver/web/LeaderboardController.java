package com.pongnet.gameserver.web;

import com.pongnet.gameserver.leaderboard.LeaderboardEntry;
import com.pongnet.gameserver.leaderboard.LeaderboardService;
import com.pongnet.gameserver.web.dto.LeaderboardEntryDto;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.util.HtmlUtils;

import java.util.List;

/**
 * Read-only leaderboard, as JSON for tools and as a small HTML page for browsers.
 */
@RestController
public class LeaderboardController {
    static final int MAX_LIMIT = 100;

    private final LeaderboardService leaderboardService;

    public LeaderboardController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @GetMapping("/api/leaderboard")
    public ResponseEntity<List<LeaderboardEntryDto>> leaderboard(
            @RequestParam(name = "limit", defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_LIMIT);
        }
        return ResponseEntity.ok(leaderboardService.topN(limit).stream()
                .map(LeaderboardEntryDto::from)
                .toList());
    }

    @GetMapping(value = {"/", "/leaderboard"}, produces = MediaType.TEXT_HTML_VALUE)
    public String page() {
        StringBuilder html = new StringBuilder()
                .append("<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>Pong leaderboard</title></head>")
                .append("<body><h1>Leaderboard</h1>");
        List<LeaderboardEntry> entries = leaderboardService.topN(10);
        if (entries.isEmpty()) {
            html.append("<p>No players yet.</p>");
        } else {
            html.append("<table><tr><th>#</th><th>Player</th><th>Wins</th></tr>");
            for (LeaderboardEntry entry : entries) {
                html.append("<tr><td>").append(entry.rank())
                        .append("</td><td>").append(HtmlUtils.htmlEscape(entry.username()))
                        .append("</td><td>").append(entry.wins())
                        .append("</td></tr>");
            }
            html.append("</table>");
        }
        return html.append("</body></html>").toString();
    }
}
