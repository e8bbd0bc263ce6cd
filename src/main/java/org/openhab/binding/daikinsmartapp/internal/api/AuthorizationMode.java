package org.openhab.binding.daikinsmartapp.internal.api;

import org.openhab.binding.daikinsmartapp.internal.DaikinSmartAppBindingConstants;

/**
 * Which issued token is presented as bearer. The other one is the fallback.
 */
public enum AuthorizationMode {
    ID_TOKEN,
    ACCESS_TOKEN;

    public AuthorizationMode other() {
        return this == ID_TOKEN ? ACCESS_TOKEN : ID_TOKEN;
    }

    public static AuthorizationMode fromConfig(String value) {
        return DaikinSmartAppBindingConstants.AUTH_MODE_ACCESS_TOKEN.equals(value) ? ACCESS_TOKEN : ID_TOKEN;
    }
}
