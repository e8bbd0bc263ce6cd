package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Thrown when the unit catalog cannot be fetched or parsed.
 */
@NonNullByDefault
public class DiscoveryFailedException extends DaikinException {

    private static final long serialVersionUID = 1L;

    public DiscoveryFailedException(String message) {
        super(message);
    }

    public DiscoveryFailedException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
