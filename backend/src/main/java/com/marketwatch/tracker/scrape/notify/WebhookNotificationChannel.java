package com.marketwatch.tracker.scrape.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.http.PoliteHttpClient;
import com.marketwatch.tracker.scrape.model.HttpFetchResult;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.NotificationEvent;
import org.springframework.stereotype.Component;

/**
 * Discord-compatible webhook: {@code content} carries the readable summary and the
 * remaining fields carry structured data for other consumers.
 */
@Component
public class WebhookNotificationChannel implements NotificationChannel {
    private static final int DISCORD_CONTENT_LIMIT = 2000;

    private final ScraperProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookNotificationChannel(ScraperProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return properties.getNotifications().getWebhook().isEnabled();
    }

    @Override
    public void deliver(NotificationEvent event) throws DeliveryException {
        String url = properties.getNotifications().getWebhook().getUrl();
        String payload = payload(event);
        HttpFetchResult result = httpClient.postJson(url, payload, null);
        if (result.errorCode() != null) {
            throw new DeliveryException("webhook " + result.errorCode() + ": " + result.errorMessage());
        }
        if (!result.isSuccessful()) {
            throw new DeliveryException("webhook returned HTTP " + result.statusCode());
        }
    }

    // Never splits a surrogate pair.
    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(text.charAt(end - 1)) && Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return text.substring(0, end);
    }

    String payload(NotificationEvent event) throws DeliveryException {
        int sampleLimit = properties.getNotifications().getWebhook().getSampleLimit();
        ObjectNode root = objectMapper.createObjectNode();
        String content = NotificationMessages.body(event, sampleLimit);
        if (content.length() > DISCORD_CONTENT_LIMIT) {
            content = truncate(content, DISCORD_CONTENT_LIMIT - 3) + "...";
        }
        root.put("content", content);
        root.put("savedSearchId", event.savedSearchId());
        root.put("searchName", event.searchName());
        root.put("newItemCount", event.newItemCount());
        root.put("cycleTimestamp", event.cycleTimestamp() == null ? null : event.cycleTimestamp().toString());
        ArrayNode samples = root.putArray("samples");
        for (MarketplaceListing listing : NotificationMessages.cheapest(event, sampleLimit)) {
            ObjectNode sample = samples.addObject();
            sample.put("site", listing.site().key());
            sample.put("externalId", listing.externalId());
            sample.put("title", listing.title());
            sample.put("priceMinor", listing.priceMinor());
            sample.put("currency", listing.currency());
            sample.put("url", listing.url());
            sample.put("imageUrl", listing.imageUrl());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("could not serialize webhook payload", e);
        }
    }
}
