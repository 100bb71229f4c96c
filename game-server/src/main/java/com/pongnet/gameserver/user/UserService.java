package com.pongnet.gameserver.user;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Pattern;

@Service
public class UserService implements UserCredentialService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9_.-]{3,40}");

    private final AppUserRepository repository;
    private final PasswordEncoder passwordEncoder;

    public UserService(AppUserRepository repository, PasswordEncoder passwordEncoder) {
        this.repository = repository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public AppUser register(String username, String rawPassword) {
        String normalizedUsername = requireValidUsername(username);
        if (rawPassword == null || rawPassword.isEmpty()) {
            throw new AuthException(AuthException.Reason.INVALID_PASSWORD, "Password is required");
        }
        if (repository.existsByUsername(normalizedUsername)) {
            throw new AuthException(AuthException.Reason.USERNAME_TAKEN, "Username is already taken");
        }

        AppUser user = new AppUser(normalizedUsername, passwordEncoder.encode(rawPassword));
        AppUser saved;
        try {
            // the unique key decides between two concurrent registrations
            saved = repository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new AuthException(AuthException.Reason.USERNAME_TAKEN, "Username is already taken", e);
        }
        log.info("Registered new player '{}'", saved.getUsername());
        return saved;
    }

    @Override
    public AppUser verify(String username, String rawPassword) {
        if (username == null || rawPassword == null) {
            throw new AuthException(AuthException.Reason.UNKNOWN_USER, "Unknown user");
        }
        AppUser user = repository.findByUsername(username.trim())
                .orElseThrow(() -> new AuthException(AuthException.Reason.UNKNOWN_USER, "Unknown user"));

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            throw new AuthException(AuthException.Reason.BAD_PASSWORD, "Invalid credentials");
        }
        return user;
    }

    public Optional<AppUser> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return repository.findByUsername(username.trim());
    }

    private String requireValidUsername(String username) {
        String trimmed = username == null ? "" : username.trim();
        if (!USERNAME.matcher(trimmed).matches()) {
            throw new AuthException(AuthException.Reason.INVALID_USERNAME,
                    "Username must be 3-40 characters of letters, digits, '_', '.' or '-'");
        }
        return trimmed;
    }
}
