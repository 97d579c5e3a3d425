package com.questrail.seabird.radio.radio;

import com.questrail.seabird.radio.api.ChannelSource;
import com.questrail.seabird.radio.api.ChatUser;

/**
 * Reply text helpers.
 */
final class Replies {

    private Replies() {}

    /**
     * Prefix {@code message} with {@code "<display name>: "} when the
     * command came from a known user.
     */
    static String addressedTo(ChannelSource source, String message) {
        return source.user()
                .map(ChatUser::displayName)
                .map(name -> name + ": " + message)
                .orElse(message);
    }
}
