package com.lob.protocol;

/**
 * What happens when an incoming order would trade against a resting order
 * of the same owner. Owner id 0 is anonymous and never self-matches.
 */
public enum SelfMatchPolicy {
    /** Orders of the same owner trade with each other. */
    ALLOW,
    /** The resting order is cancelled and matching continues behind it. */
    CANCEL_RESTING,
    /** Matching stops and the incoming remainder is cancelled. */
    CANCEL_INCOMING;

    public static SelfMatchPolicy parse(String name) {
        return valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
