package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Thrown when the vendor rejects the account credentials. Never retried; the user has to re-enter them.
 */
@NonNullByDefault
public class AuthenticationFailedException extends DaikinException {

    private static final long serialVersionUID = 1L;

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
