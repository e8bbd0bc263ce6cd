package org.openhab.binding.daikinsmartapp.internal.store;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.exception.NotConfiguredException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.model.Session;

/**
 * Durable home of the account credential and the last issued session. These
 * are the only values that survive a restart; devices are rediscovered.
 */
@NonNullByDefault
public interface CredentialStore {

    /**
     * @throws NotConfiguredException if no credential has been stored
     */
    Credential get() throws NotConfiguredException;

    /**
     * Stores the credential, replacing any previous one.
     */
    void set(Credential credential);

    @Nullable
    Session getSession();

    /**
     * Stores the session, or forgets it when {@code null}.
     */
    void setSession(@Nullable Session session);

    /**
     * Removes credential and session, used when the account is removed.
     */
    void clear();
}
