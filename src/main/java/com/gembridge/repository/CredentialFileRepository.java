package com.gembridge.repository;

import com.gembridge.config.GembridgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * File-per-project credential storage.
 * Identities are absolute file paths, plus {@link #ENV_IDENTITY} when a credential
 * blob was supplied through configuration. Blocking; callers move it off event-loop threads.
 */
@Slf4j
@Repository
public class CredentialFileRepository {

    public static final String ENV_IDENTITY = "env:GEMINI_CREDENTIALS";

    private static final String FILE_GLOB = "*.json";

    private final Path directory;
    private final AtomicReference<String> environmentCredential;

    public CredentialFileRepository(GembridgeProperties properties) {
        this.directory = Path.of(properties.getCredentials().getDir()).toAbsolutePath().normalize();
        String json = properties.getCredentials().getJson();
        this.environmentCredential = new AtomicReference<>(json != null && !json.isBlank() ? json : null);
    }

    /**
     * List credential identities: the configured blob first, then files ordered by name.
     */
    public List<String> listIdentities() {
        List<String> identities = new ArrayList<>();
        if (environmentCredential.get() != null) {
            identities.add(ENV_IDENTITY);
        }

        if (!Files.isDirectory(directory)) {
            log.debug("Credential directory {} does not exist", directory);
            return identities;
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, FILE_GLOB)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            log.error("Failed to list credential directory {}", directory, e);
            return identities;
        }

        files.sort(Comparator.comparing(file -> file.getFileName().toString()));
        files.forEach(file -> identities.add(file.toString()));
        return identities;
    }

    /**
     * Read the raw JSON stored under an identity.
     */
    public String read(String identity) throws IOException {
        if (ENV_IDENTITY.equals(identity)) {
            String json = environmentCredential.get();
            if (json == null) {
                throw new NoSuchFileException(identity);
            }
            return json;
        }
        return Files.readString(Path.of(identity), StandardCharsets.UTF_8);
    }

    /**
     * Replace the JSON stored under an identity. Files are written to a sibling
     * temp file first and moved into place.
     */
    public void write(String identity, String json) throws IOException {
        if (ENV_IDENTITY.equals(identity)) {
            environmentCredential.set(json);
            log.debug("Updated in-memory credential {}", identity);
            return;
        }

        Path target = Path.of(identity);
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote credential file {}", target);
    }

    public Path getDirectory() {
        return directory;
    }
}
