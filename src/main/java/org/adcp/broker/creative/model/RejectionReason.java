package org.adcp.broker.creative.model;

public enum RejectionReason {

    NO_PLACEHOLDERS_CONFIGURED,
    SLOT_MISMATCH
}
