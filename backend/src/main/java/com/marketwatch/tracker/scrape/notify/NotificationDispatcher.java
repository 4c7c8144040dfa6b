package com.marketwatch.tracker.scrape.notify;

import com.marketwatch.tracker.scrape.model.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationChannel> channels;

    public NotificationDispatcher(List<NotificationChannel> channels) {
        this.channels = List.copyOf(channels);
    }

    public DispatchReport dispatch(List<NotificationEvent> events) {
        if (events == null || events.isEmpty()) {
            return DispatchReport.empty();
        }
        int delivered = 0;
        int failed = 0;
        for (NotificationEvent event : events) {
            for (NotificationChannel channel : channels) {
                if (!channel.isEnabled()) {
                    continue;
                }
                try {
                    channel.deliver(event);
                    delivered++;
                } catch (DeliveryException e) {
                    failed++;
                    log.warn("{} delivery failed for search {}: {}", channel.name(), event.savedSearchId(), e.getMessage());
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("{} channel crashed for search {}", channel.name(), event.savedSearchId(), e);
                }
            }
        }
        log.info("Dispatched {} events: {} deliveries, {} failures", events.size(), delivered, failed);
        return new DispatchReport(events.size(), delivered, failed);
    }
}
