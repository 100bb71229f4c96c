package com.pongnet.gameserver.user;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "players",
        uniqueConstraints = @UniqueConstraint(name = "uk_players_username", columnNames = "username"))
public class AppUser {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 40)
    private String username;

    @Column(nullable = false)
    private String passwordHash;

    @Column(nullable = false)
    private int winCount;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    protected AppUser() {
    }

    public AppUser(String username, String passwordHash) {
        this.username = username;
        this.passwordHash = passwordHash;
        this.createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public int getWinCount() {
        return winCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
