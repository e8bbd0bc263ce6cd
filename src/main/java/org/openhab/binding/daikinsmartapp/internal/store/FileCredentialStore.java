package org.openhab.binding.daikinsmartapp.internal.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.exception.NotConfiguredException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Keeps credential and session in a single JSON file. The file is read once
 * on first access and rewritten through a temporary file on every change.
 */
@NonNullByDefault
public class FileCredentialStore implements CredentialStore {

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(FileCredentialStore.class));
    private static final Gson GSON = new Gson();

    private final Path file;
    private boolean loaded;
    private @Nullable Credential credential;
    private @Nullable Session session;

    public FileCredentialStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized Credential get() throws NotConfiguredException {
        ensureLoaded();
        Credential localCredential = credential;
        if (localCredential == null) {
            throw new NotConfiguredException("No account credential configured");
        }
        return localCredential;
    }

    @Override
    public synchronized void set(Credential newCredential) {
        ensureLoaded();
        Credential previous = credential;
        credential = Objects.requireNonNull(newCredential, "credential");
        if (previous != null && !previous.getUsername().equals(newCredential.getUsername())) {
            // a session belongs to the account it was issued for
            session = null;
        }
        write();
    }

    @Override
    public synchronized @Nullable Session getSession() {
        ensureLoaded();
        return session;
    }

    @Override
    public synchronized void setSession(@Nullable Session newSession) {
        ensureLoaded();
        session = newSession;
        write();
    }

    @Override
    public synchronized void clear() {
        loaded = true;
        credential = null;
        session = null;
        try {
            Files.deleteIfExists(file);
            logger.debug("Removed credential store {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to delete credential store " + file, e);
        }
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        loaded = true;
        if (!Files.exists(file)) {
            logger.trace("Credential store {} does not exist yet", file);
            return;
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            StoredAccount stored = GSON.fromJson(content, StoredAccount.class);
            if (stored == null) {
                return;
            }
            credential = stored.toCredential();
            session = stored.toSession();
            logger.debug("Loaded credential store {} (session present: {})", file, session != null);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read credential store " + file, e);
        } catch (JsonParseException | IllegalArgumentException e) {
            logger.warn("Ignoring unreadable credential store {}: {}", file, e.getMessage());
        }
    }

    private void write() {
        StoredAccount stored = StoredAccount.from(credential, session);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(temp, GSON.toJson(stored), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.trace("Wrote credential store {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write credential store " + file, e);
        }
    }

    /**
     * Serialized form. Instants are kept as epoch milliseconds.
     */
    private static final class StoredAccount {
        @Nullable
        String username;
        @Nullable
        String password;
        @Nullable
        String accessToken;
        @Nullable
        String idToken;
        @Nullable
        String refreshToken;
        long issuedAt;
        long expiresAt;

        static StoredAccount from(@Nullable Credential credential, @Nullable Session session) {
            StoredAccount stored = new StoredAccount();
            if (credential != null) {
                stored.username = credential.getUsername();
                stored.password = credential.getPassword();
            }
            if (session != null) {
                stored.accessToken = session.getAccessToken();
                stored.idToken = session.getIdToken();
                stored.refreshToken = session.getRefreshToken();
                stored.issuedAt = session.getIssuedAt().toEpochMilli();
                stored.expiresAt = session.getExpiresAt().toEpochMilli();
            }
            return stored;
        }

        @Nullable
        Credential toCredential() {
            String localUser = username;
            String localPassword = password;
            if (localUser == null || localPassword == null) {
                return null;
            }
            return new Credential(localUser, localPassword);
        }

        @Nullable
        Session toSession() {
            if (accessToken == null && idToken == null) {
                return null;
            }
            return new Session(accessToken, idToken, refreshToken, Instant.ofEpochMilli(issuedAt),
                    Instant.ofEpochMilli(expiresAt));
        }
    }
}
