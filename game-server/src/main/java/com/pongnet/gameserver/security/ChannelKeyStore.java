package com.pongnet.gameserver.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.keygen.KeyGenerators;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Base64;

/**
 * Loads the process-wide channel key from its key file, generating the file on first run.
 * The file holds the Base64 form of a 256-bit AES key.
 */
public final class ChannelKeyStore {
    private static final Logger log = LoggerFactory.getLogger(ChannelKeyStore.class);
    static final int KEY_BYTES = 32;

    private ChannelKeyStore() {
    }

    public static SecretKey loadOrCreate(Path keyFile) throws IOException {
        byte[] raw;
        if (Files.exists(keyFile)) {
            String encoded = Files.readString(keyFile, StandardCharsets.US_ASCII).trim();
            try {
                raw = Base64.getDecoder().decode(encoded);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Key file " + keyFile + " is not valid Base64", e);
            }
            if (raw.length != KEY_BYTES) {
                throw new IllegalStateException("Key file " + keyFile + " must hold " + KEY_BYTES
                        + " bytes, found " + raw.length);
            }
            log.info("Loaded channel key from {}", keyFile.toAbsolutePath());
        } else {
            raw = KeyGenerators.secureRandom(KEY_BYTES).generateKey();
            Path parent = keyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(keyFile, Base64.getEncoder().encodeToString(raw), StandardCharsets.US_ASCII);
            restrictPermissions(keyFile);
            log.info("Generated new channel key at {}", keyFile.toAbsolutePath());
        }
        return new SecretKeySpec(raw, "AES");
    }

    private static void restrictPermissions(Path keyFile) {
        try {
            Files.setPosixFilePermissions(keyFile, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not restrict permissions on {}: {}", keyFile, e.getMessage());
        }
    }
}
