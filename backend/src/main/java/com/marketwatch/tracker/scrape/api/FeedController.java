package com.marketwatch.tracker.scrape.api;

import com.marketwatch.tracker.scrape.model.FeedEntryView;
import com.marketwatch.tracker.scrape.service.FeedService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/feed")
public class FeedController {
    private final FeedService feedService;

    public FeedController(FeedService feedService) {
        this.feedService = feedService;
    }

    @GetMapping
    public List<FeedEntryView> feed(
        @RequestParam(name = "savedSearchId", required = false) Long savedSearchId,
        @RequestParam(name = "unreadOnly", required = false, defaultValue = "false") boolean unreadOnly,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return feedService.getFeed(savedSearchId, unreadOnly, limit);
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<Void> markRead(@PathVariable("id") long id) {
        feedService.markRead(id);
        return ResponseEntity.noContent().build();
    }
}
