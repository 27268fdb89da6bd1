package com.phantom.gateway.service;

/**
 * Hooks handled by {@link PhantomTokenDispatcher}.
 */
public enum HookName {

    /** Phase 1: exchange the opaque bearer token for a JWT */
    PHANTOM_AUTH_CHECK("PhantomAuthCheck"),

    /** Phase 2: put the JWT on the upstream Authorization header */
    INJECT_JWT_POST_KEY_AUTH("InjectJwtPostKeyAuth"),

    /** Any other hook; the object passes through unchanged */
    UNRECOGNIZED(null);

    private final String wireName;

    HookName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static HookName from(String name) {
        for (HookName hook : values()) {
            if (hook.wireName != null && hook.wireName.equals(name)) {
                return hook;
            }
        }
        return UNRECOGNIZED;
    }
}
