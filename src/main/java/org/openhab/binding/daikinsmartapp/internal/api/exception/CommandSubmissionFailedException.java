package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Thrown when a command was not accepted by the vendor.
 */
@NonNullByDefault
public class CommandSubmissionFailedException extends DaikinException {

    private static final long serialVersionUID = 1L;

    public CommandSubmissionFailedException(String message) {
        super(message);
    }

    public CommandSubmissionFailedException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
