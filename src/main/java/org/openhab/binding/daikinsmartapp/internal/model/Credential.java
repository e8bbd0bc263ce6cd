package org.openhab.binding.daikinsmartapp.internal.model;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Account username and password. Never mutated once created.
 */
@NonNullByDefault
public final class Credential {
    private final String username;
    private final String password;

    public Credential(String username, String password) {
        if (username.isBlank()) {
            throw new IllegalArgumentException("Username must not be empty");
        }
        if (password.isEmpty()) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        this.username = username;
        this.password = password;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Credential)) {
            return false;
        }
        Credential other = (Credential) o;
        return username.equals(other.username) && password.equals(other.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, password);
    }

    @Override
    public String toString() {
        return "Credential[" + username + ", password=***REDACTED***]";
    }
}
