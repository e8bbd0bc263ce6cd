package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Base class for all errors reported by the Daikin cloud core.
 */
@NonNullByDefault
public class DaikinException extends Exception {

    private static final long serialVersionUID = 1L;

    public DaikinException(String message) {
        super(message);
    }

    public DaikinException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
