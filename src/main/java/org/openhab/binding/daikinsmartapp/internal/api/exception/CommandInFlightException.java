package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Thrown when a unit still has an unconfirmed command.
 */
@NonNullByDefault
public class CommandInFlightException extends DaikinException {

    private static final long serialVersionUID = 1L;

    public CommandInFlightException(String message) {
        super(message);
    }

    public CommandInFlightException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
