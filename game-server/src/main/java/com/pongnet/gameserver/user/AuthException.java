package com.pongnet.gameserver.user;

import java.util.Locale;

public class AuthException extends RuntimeException {

    public enum Reason {
        USERNAME_TAKEN,
        UNKNOWN_USER,
        BAD_PASSWORD,
        INVALID_USERNAME,
        INVALID_PASSWORD,
        ALREADY_SEATED;

        /** Wire form used in {@code ERR <reason>} replies, e.g. {@code username-taken}. */
        public String code() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
