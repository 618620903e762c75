package com.mirrorwatch.watch.delivery;

import com.mirrorwatch.watch.model.PushPayload;

public interface NotificationChannel {
    /**
     * Unique among configured channels; part of every push task id.
     */
    String name();

    ChannelType type();

    /**
     * @throws DeliveryException when the channel did not accept the message
     */
    void send(PushPayload payload);
}
