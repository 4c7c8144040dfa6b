package com.marketwatch.tracker.scrape.notify;

import com.marketwatch.tracker.scrape.model.NotificationEvent;

public interface NotificationChannel {
    String name();

    boolean isEnabled();

    void deliver(NotificationEvent event) throws DeliveryException;
}
