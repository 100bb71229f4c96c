package com.pongnet.gameserver.net;

import java.util.Locale;

/**
 * A parsed {@code register <user> <pass>} or {@code login <user> <pass>} line.
 */
record AuthRequest(boolean register, String username, String password) {

    static AuthRequest parse(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length != 3) {
            throw new ProtocolException("expected '<register|login> <user> <pass>'");
        }
        return switch (parts[0].toLowerCase(Locale.ROOT)) {
            case "register" -> new AuthRequest(true, parts[1], parts[2]);
            case "login" -> new AuthRequest(false, parts[1], parts[2]);
            default -> throw new ProtocolException("unknown auth command '" + parts[0] + "'");
        };
    }

    @Override
    public String toString() {
        return (register ? "register " : "login ") + username;
    }
}
