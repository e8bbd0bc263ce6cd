package org.openhab.binding.daikinsmartapp.internal.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.DaikinException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.SessionUnstableException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.model.Session;
import org.openhab.binding.daikinsmartapp.internal.store.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single session of an account.
 * <p>
 * Logins are single-flight: when the cached session is missing or expired the
 * first caller logs in and every concurrent caller waits for and shares that
 * result. A rejected credential is remembered and not retried until
 * {@link #reset()} or {@link #updateCredential(Credential)}. Too many
 * invalidations within the configured window latch the manager into the
 * unstable state.
 */
@NonNullByDefault
public class SessionManager {

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(SessionManager.class));

    private final CredentialStore store;
    private final DaikinAuthClient authClient;
    private final Clock clock;
    private final Duration safetyMargin;
    private final int maxInvalidations;
    private final Duration invalidationWindow;

    private final Object lock = new Object();
    private final Deque<Instant> invalidations = new ArrayDeque<>();
    private boolean sessionLoaded;
    private @Nullable Session session;
    private @Nullable CompletableFuture<Session> loginInFlight;
    private @Nullable AuthenticationFailedException authFailure;
    private boolean unstable;

    public SessionManager(CredentialStore store, DaikinAuthClient authClient, Clock clock, Duration safetyMargin,
            int maxInvalidations, Duration invalidationWindow) {
        this.store = Objects.requireNonNull(store, "store");
        this.authClient = Objects.requireNonNull(authClient, "authClient");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.safetyMargin = Objects.requireNonNull(safetyMargin, "safetyMargin");
        this.maxInvalidations = Math.max(1, maxInvalidations);
        this.invalidationWindow = Objects.requireNonNull(invalidationWindow, "invalidationWindow");
    }

    /**
     * Returns a session that is not expired, logging in when needed.
     *
     * @throws AuthenticationFailedException if the credential was rejected, now
     *             or by an earlier login
     * @throws SessionUnstableException after repeated invalidations
     * @throws IOException if the login endpoint could not be reached
     */
    public Session ensureSession() throws DaikinException, IOException, InterruptedException {
        CompletableFuture<Session> flight;
        boolean leader = false;
        synchronized (lock) {
            if (unstable) {
                throw new SessionUnstableException(String.format(
                        "Session was invalidated %d times within %s; giving up", maxInvalidations,
                        invalidationWindow));
            }
            AuthenticationFailedException localFailure = authFailure;
            if (localFailure != null) {
                throw new AuthenticationFailedException(
                        "Credential was rejected earlier: " + localFailure.getMessage(), localFailure);
            }
            if (!sessionLoaded) {
                sessionLoaded = true;
                session = store.getSession();
                if (session != null) {
                    logger.debug("Loaded persisted session, valid until {}", session.getExpiresAt());
                }
            }
            Session current = session;
            if (current != null && !current.isExpired(clock.instant(), safetyMargin)) {
                return current;
            }
            flight = loginInFlight;
            if (flight == null) {
                flight = new CompletableFuture<>();
                loginInFlight = flight;
                leader = true;
            }
        }

        if (!leader) {
            logger.trace("Waiting for login already in progress");
            return await(flight);
        }
        return login(flight);
    }

    private Session login(CompletableFuture<Session> flight) throws DaikinException, IOException, InterruptedException {
        Session fresh;
        try {
            Credential credential = store.get();
            logger.info("Logging in to Daikin cloud as {}", credential.getUsername());
            fresh = authClient.login(credential);
        } catch (AuthenticationFailedException e) {
            logger.warn("Login rejected: {}", e.getMessage());
            synchronized (lock) {
                authFailure = e;
                loginInFlight = null;
            }
            flight.completeExceptionally(e);
            throw e;
        } catch (DaikinException | IOException | InterruptedException | RuntimeException e) {
            logger.debug("Login failed: {}", e.getMessage());
            synchronized (lock) {
                loginInFlight = null;
            }
            flight.completeExceptionally(e);
            throw e;
        }

        synchronized (lock) {
            session = fresh;
            loginInFlight = null;
            persist(fresh);
        }
        flight.complete(fresh);
        return fresh;
    }

    private Session await(CompletableFuture<Session> flight) throws DaikinException, IOException, InterruptedException {
        try {
            return Objects.requireNonNull(flight.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DaikinException) {
                throw (DaikinException) cause;
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof InterruptedException) {
                throw new IOException("Login was interrupted in another thread", cause);
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Login failed", cause);
        }
    }

    /**
     * Drops the current session after the cloud rejected it as unauthorized.
     */
    public void invalidate() {
        Session current;
        synchronized (lock) {
            current = session;
        }
        if (current != null) {
            invalidate(current);
        }
    }

    /**
     * Drops {@code rejected} if it is still the current session. A session that
     * was already replaced by a concurrent login is left alone, so one expiry
     * seen by several requests counts once.
     */
    public void invalidate(Session rejected) {
        synchronized (lock) {
            if (session != rejected) {
                logger.debug("Ignoring invalidation of a session that was already replaced");
                return;
            }
            session = null;
            Instant now = clock.instant();
            pruneInvalidations(now);
            invalidations.addLast(now);
            if (invalidations.size() >= maxInvalidations) {
                unstable = true;
                logger.warn("Session invalidated {} times within {}; marking session unstable",
                        invalidations.size(), invalidationWindow);
            } else {
                logger.info("Session invalidated by the cloud ({} of {} within {})", invalidations.size(),
                        maxInvalidations, invalidationWindow);
            }
            persist(null);
        }
    }

    /**
     * Called after a request was accepted with the current session; ends a run
     * of consecutive invalidations.
     */
    public void reportAuthorized() {
        synchronized (lock) {
            invalidations.clear();
        }
    }

    /**
     * Clears the rejected-credential and unstable latches.
     */
    public void reset() {
        synchronized (lock) {
            authFailure = null;
            unstable = false;
            invalidations.clear();
        }
    }

    /**
     * Stores a new credential and forgets the current session, so the next
     * {@link #ensureSession()} logs in with it.
     */
    public void updateCredential(Credential credential) {
        store.set(credential);
        synchronized (lock) {
            session = null;
            sessionLoaded = true;
            authFailure = null;
            unstable = false;
            invalidations.clear();
            persist(null);
        }
    }

    public @Nullable Session getCurrentSession() {
        synchronized (lock) {
            return session;
        }
    }

    /**
     * Whether a login was rejected and no new credential was stored since.
     */
    public boolean isCredentialRejected() {
        synchronized (lock) {
            return authFailure != null;
        }
    }

    public boolean isUnstable() {
        synchronized (lock) {
            return unstable;
        }
    }

    private void pruneInvalidations(Instant now) {
        Instant cutoff = now.minus(invalidationWindow);
        while (!invalidations.isEmpty() && invalidations.peekFirst().isBefore(cutoff)) {
            invalidations.removeFirst();
        }
    }

    /**
     * Writes the session through to the store. Callers hold {@code lock}, so
     * the stored session always matches the one in memory.
     */
    private void persist(@Nullable Session value) {
        try {
            store.setSession(value);
        } catch (UncheckedIOException e) {
            logger.warn("Failed to persist session: {}", e.getMessage());
        }
    }
}
