package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Thrown when no account credential is configured.
 */
@NonNullByDefault
public class NotConfiguredException extends DaikinException {

    private static final long serialVersionUID = 1L;

    public NotConfiguredException(String message) {
        super(message);
    }

    public NotConfiguredException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
