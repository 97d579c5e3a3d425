package com.questrail.seabird.radio.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ChannelSource
 * -----------------------------------------------------------------------------
 * Where a command came from. The plugin treats these fields as opaque
 * passthrough: the channel id is echoed on the reply and the display name is
 * only used to address the reply text to the invoking user.
 */
public record ChannelSource(String channelId, Optional<ChatUser> user) {
    public ChannelSource {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(user, "user");
    }

    public static ChannelSource of(String channelId, ChatUser user) {
        return new ChannelSource(channelId, Optional.ofNullable(user));
    }
}
