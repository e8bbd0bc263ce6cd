package org.openhab.binding.daikinsmartapp.internal.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Tokens issued by one successful login. Replaced wholesale, never patched.
 * The vendor does not report an expiry, so {@code expiresAt} is the local
 * estimate taken at issue time.
 */
@NonNullByDefault
public final class Session {
    private final @Nullable String accessToken;
    private final @Nullable String idToken;
    private final @Nullable String refreshToken;
    private final Instant issuedAt;
    private final Instant expiresAt;

    public Session(@Nullable String accessToken, @Nullable String idToken, @Nullable String refreshToken,
            Instant issuedAt, Instant expiresAt) {
        if (isBlank(accessToken) && isBlank(idToken)) {
            throw new IllegalArgumentException("Session requires an access token or an id token");
        }
        this.accessToken = accessToken;
        this.idToken = idToken;
        this.refreshToken = refreshToken;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public @Nullable String getAccessToken() {
        return accessToken;
    }

    public @Nullable String getIdToken() {
        return idToken;
    }

    public @Nullable String getRefreshToken() {
        return refreshToken;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * A session counts as expired once {@code now >= expiresAt - safetyMargin}.
     */
    public boolean isExpired(Instant now, Duration safetyMargin) {
        return !now.isBefore(expiresAt.minus(safetyMargin));
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return "Session[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
