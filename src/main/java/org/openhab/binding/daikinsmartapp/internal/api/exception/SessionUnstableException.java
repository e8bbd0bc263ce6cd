package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Thrown when sessions keep getting revoked right after login.
 */
@NonNullByDefault
public class SessionUnstableException extends DaikinException {

    private static final long serialVersionUID = 1L;

    public SessionUnstableException(String message) {
        super(message);
    }

    public SessionUnstableException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
