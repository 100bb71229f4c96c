package com.pongnet.gameserver.security;

/**
 * An envelope could not be opened: corrupt, truncated, tampered with or sealed under another key.
 */
public class CryptoException extends RuntimeException {
    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
