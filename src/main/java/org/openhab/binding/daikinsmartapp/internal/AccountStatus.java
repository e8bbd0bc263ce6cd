package org.openhab.binding.daikinsmartapp.internal;

/**
 * Status of an account, the way a bridge reports it.
 */
public enum AccountStatus {
    UNINITIALIZED,
    ONLINE,
    OFFLINE;

    /**
     * Why an account is offline.
     */
    public enum Detail {
        NONE,
        CONFIGURATION_ERROR,
        COMMUNICATION_ERROR
    }
}
