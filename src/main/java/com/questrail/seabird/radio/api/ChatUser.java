package com.questrail.seabird.radio.api;

import java.util.Objects;

/**
 * User that invoked a command, as reported by the core.
 */
public record ChatUser(String id, String displayName) {
    public ChatUser {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
    }
}
