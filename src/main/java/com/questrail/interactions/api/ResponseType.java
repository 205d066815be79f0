package com.questrail.interactions.api;

/**
 * Initial response types, with the platform's wire codes.
 */
public enum ResponseType {
    MESSAGE_CREATE(4, false),
    DEFERRED_MESSAGE_CREATE(5, true),
    DEFERRED_MESSAGE_UPDATE(6, true),
    MESSAGE_UPDATE(7, false);

    private final int code;
    private final boolean deferred;

    ResponseType(int code, boolean deferred) {
        this.code = code;
        this.deferred = deferred;
    }

    public int code() {
        return code;
    }

    public boolean isDeferred() {
        return deferred;
    }

    /** Whether this type creates a new message rather than updating the source one. */
    public boolean createsMessage() {
        return this == MESSAGE_CREATE || this == DEFERRED_MESSAGE_CREATE;
    }

    public static ResponseType fromCode(int code) {
        for (ResponseType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown response type code: " + code);
    }
}
