package com.pongnet.gameserver.user;

/**
 * Registered players and their salted password digests.
 * Failures are reported as {@link AuthException} with the matching {@link AuthException.Reason}.
 */
public interface UserCredentialService {
    AppUser register(String username, String rawPassword);
    AppUser verify(String username, String rawPassword);
}
