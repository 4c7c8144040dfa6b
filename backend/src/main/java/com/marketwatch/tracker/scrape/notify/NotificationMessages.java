package com.marketwatch.tracker.scrape.notify;

import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.NotificationEvent;

import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;

final class NotificationMessages {
    private NotificationMessages() {
    }

    static String title(NotificationEvent event) {
        return event.searchName() + ": " + event.newItemCount() + " new item" + (event.newItemCount() == 1 ? "" : "s");
    }

    static String body(NotificationEvent event, int previewLimit) {
        StringBuilder body = new StringBuilder(title(event));
        for (MarketplaceListing listing : cheapest(event, previewLimit)) {
            body.append('\n')
                .append("- ")
                .append(formatPrice(listing))
                .append(' ')
                .append(listing.title())
                .append(" [")
                .append(listing.site().displayName())
                .append("] ")
                .append(listing.url());
        }
        int remaining = event.newItemCount() - Math.min(previewLimit, event.newItemCount());
        if (remaining > 0) {
            body.append('\n').append("...and ").append(remaining).append(" more");
        }
        return body.toString();
    }

    static List<MarketplaceListing> cheapest(NotificationEvent event, int limit) {
        // Events already carry listings cheapest first.
        return event.newListings().subList(0, Math.min(Math.max(0, limit), event.newItemCount()));
    }

    static String formatPrice(MarketplaceListing listing) {
        String amount = NumberFormat.getIntegerInstance(Locale.JAPAN).format(listing.priceMinor());
        return "JPY".equals(listing.currency()) ? "¥" + amount : amount + " " + listing.currency();
    }
}
