package com.marketwatch.tracker.scrape.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketwatch.tracker.scrape.model.CycleRunMeta;
import com.marketwatch.tracker.scrape.model.CycleTrigger;
import com.marketwatch.tracker.scrape.model.FeedEntryView;
import com.marketwatch.tracker.scrape.model.ListingKey;
import com.marketwatch.tracker.scrape.model.MarketplaceListing;
import com.marketwatch.tracker.scrape.model.MarketplaceSite;
import com.marketwatch.tracker.scrape.model.SavedSearch;
import com.marketwatch.tracker.scrape.model.SavedSearchCycleOutcome;
import com.marketwatch.tracker.scrape.model.SavedSearchFilter;
import com.marketwatch.tracker.scrape.model.SearchCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class ScrapeJdbcRepository implements PersistenceGateway {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ScrapeJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isReachable() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (DataAccessException e) {
            log.warn("Database not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<SavedSearch> getSavedSearches(SavedSearchFilter filter) {
        Boolean notificationsEnabled = filter == null ? null : filter.notificationsEnabled();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("notificationsEnabled", notificationsEnabled);
        String sql = """
            SELECT id, name, keywords, min_price_minor, max_price_minor, sites,
                   notifications_enabled, last_cycle_at, snapshot_version
            FROM saved_searches
            WHERE is_active = TRUE
            """;
        if (notificationsEnabled != null) {
            sql += " AND notifications_enabled = :notificationsEnabled";
        }
        sql += " ORDER BY id";

        List<SavedSearchRow> rows = jdbc.query(sql, params, (rs, rowNum) -> new SavedSearchRow(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("keywords"),
            rs.getObject("min_price_minor", Long.class),
            rs.getObject("max_price_minor", Long.class),
            rs.getString("sites"),
            rs.getBoolean("notifications_enabled"),
            toInstant(rs.getTimestamp("last_cycle_at")),
            rs.getLong("snapshot_version")
        ));
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<Long, Set<ListingKey>> knownBySearch = findKnownListingIds(rows.stream().map(SavedSearchRow::id).toList());
        List<SavedSearch> searches = new ArrayList<>();
        for (SavedSearchRow row : rows) {
            SearchCriteria criteria = toCriteria(row);
            if (criteria == null) {
                continue;
            }
            searches.add(new SavedSearch(
                row.id(),
                row.name(),
                criteria,
                row.notificationsEnabled(),
                knownBySearch.getOrDefault(row.id(), Set.of()),
                row.lastCycleAt(),
                row.snapshotVersion()
            ));
        }
        return searches;
    }

    public Set<ListingKey> findKnownListingIds(long savedSearchId) {
        return findKnownListingIds(List.of(savedSearchId)).getOrDefault(savedSearchId, Set.of());
    }

    private Map<Long, Set<ListingKey>> findKnownListingIds(List<Long> savedSearchIds) {
        Map<Long, Set<ListingKey>> known = new HashMap<>();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ids", savedSearchIds);
        jdbc.query(
            """
                SELECT saved_search_id, site, external_id
                FROM saved_search_known_listings
                WHERE saved_search_id IN (:ids)
                """,
            params,
            rs -> {
                MarketplaceSite site = MarketplaceSite.fromKey(rs.getString("site"));
                if (site == null) {
                    log.warn("Ignoring known listing with unknown site {}", rs.getString("site"));
                    return;
                }
                known.computeIfAbsent(rs.getLong("saved_search_id"), ignored -> new HashSet<>())
                    .add(new ListingKey(site, rs.getString("external_id")));
            }
        );
        return known;
    }

    @Override
    public void updateSnapshot(long savedSearchId, long expectedVersion, Set<ListingKey> newKnownIds, Instant lastCycleAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", savedSearchId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("lastCycleAt", toTimestamp(lastCycleAt));
        int updated = jdbc.update(
            """
                UPDATE saved_searches
                SET last_cycle_at = :lastCycleAt,
                    snapshot_version = snapshot_version + 1
                WHERE id = :id
                  AND snapshot_version = :expectedVersion
                """,
            params
        );
        if (updated == 0) {
            Integer exists = jdbc.queryForObject(
                "SELECT COUNT(*) FROM saved_searches WHERE id = :id",
                params,
                Integer.class
            );
            if (exists == null || exists == 0) {
                throw new SavedSearchNotFoundException(savedSearchId);
            }
            throw new SnapshotConflictException(savedSearchId, expectedVersion);
        }

        Set<ListingKey> target = newKnownIds == null ? Set.of() : newKnownIds;
        Set<ListingKey> existing = findKnownListingIds(savedSearchId);
        List<SqlParameterSource> removals = new ArrayList<>();
        for (ListingKey key : existing) {
            if (!target.contains(key)) {
                removals.add(keyParams(savedSearchId, key, lastCycleAt));
            }
        }
        List<SqlParameterSource> additions = new ArrayList<>();
        for (ListingKey key : target) {
            if (!existing.contains(key)) {
                additions.add(keyParams(savedSearchId, key, lastCycleAt));
            }
        }
        if (!removals.isEmpty()) {
            jdbc.batchUpdate(
                """
                    DELETE FROM saved_search_known_listings
                    WHERE saved_search_id = :savedSearchId
                      AND site = :site
                      AND external_id = :externalId
                    """,
                removals.toArray(new SqlParameterSource[0])
            );
        }
        if (!additions.isEmpty()) {
            jdbc.batchUpdate(
                """
                    INSERT INTO saved_search_known_listings (saved_search_id, site, external_id, first_seen_at)
                    VALUES (:savedSearchId, :site, :externalId, :firstSeenAt)
                    """,
                additions.toArray(new SqlParameterSource[0])
            );
        }
        log.debug("Snapshot for search {} now v{} (+{} / -{})", savedSearchId, expectedVersion + 1, additions.size(), removals.size());
    }

    @Override
    public void appendFeedEntries(long savedSearchId, List<MarketplaceListing> listings, Instant addedAt) {
        if (listings == null || listings.isEmpty()) {
            return;
        }
        List<SqlParameterSource> batch = new ArrayList<>();
        for (MarketplaceListing listing : listings) {
            batch.add(new MapSqlParameterSource()
                .addValue("savedSearchId", savedSearchId)
                .addValue("site", listing.site().key())
                .addValue("externalId", listing.externalId())
                .addValue("title", listing.title())
                .addValue("priceMinor", listing.priceMinor())
                .addValue("currency", listing.currency())
                .addValue("url", listing.url())
                .addValue("imageUrl", listing.imageUrl())
                .addValue("fetchedAt", toTimestamp(listing.fetchedAt()))
                .addValue("addedAt", toTimestamp(addedAt)));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO listing_feed_entries (
                    saved_search_id, site, external_id, title, price_minor, currency,
                    url, image_url, fetched_at, added_at, is_read
                )
                VALUES (
                    :savedSearchId, :site, :externalId, :title, :priceMinor, :currency,
                    :url, :imageUrl, :fetchedAt, :addedAt, FALSE
                )
                """,
            batch.toArray(new SqlParameterSource[0])
        );
    }

    public List<FeedEntryView> findFeedEntries(Long savedSearchId, boolean unreadOnly, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("savedSearchId", savedSearchId)
            .addValue("limit", limit);
        StringBuilder sql = new StringBuilder("""
            SELECT f.id, f.saved_search_id, s.name AS search_name, f.site, f.external_id, f.title,
                   f.price_minor, f.currency, f.url, f.image_url, f.added_at, f.is_read
            FROM listing_feed_entries f
            JOIN saved_searches s ON s.id = f.saved_search_id
            WHERE 1 = 1
            """);
        if (savedSearchId != null) {
            sql.append(" AND f.saved_search_id = :savedSearchId");
        }
        if (unreadOnly) {
            sql.append(" AND f.is_read = FALSE");
        }
        sql.append(" ORDER BY f.added_at DESC, f.price_minor ASC, f.id ASC LIMIT :limit");
        return jdbc.query(sql.toString(), params, feedEntryMapper());
    }

    public boolean markFeedEntryRead(long feedEntryId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", feedEntryId);
        return jdbc.update("UPDATE listing_feed_entries SET is_read = TRUE WHERE id = :id", params) > 0;
    }

    public int deleteFeedEntriesAddedBefore(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff));
        return jdbc.update("DELETE FROM listing_feed_entries WHERE added_at < :cutoff", params);
    }

    public long insertCycle(CycleTrigger trigger, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("trigger", trigger.name())
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", "RUNNING")
            .addValue("lastHeartbeatAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_cycles (trigger_source, started_at, status, last_heartbeat_at)
                VALUES (:trigger, :startedAt, :status, :lastHeartbeatAt)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert scrape cycle");
        }
        return key.longValue();
    }

    public void updateCycleHeartbeat(long cycleId, Instant heartbeatAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cycleId", cycleId)
            .addValue("lastHeartbeatAt", toTimestamp(heartbeatAt));
        jdbc.update(
            """
                UPDATE scrape_cycles
                SET last_heartbeat_at = COALESCE(:lastHeartbeatAt, last_heartbeat_at)
                WHERE id = :cycleId
                """,
            params
        );
    }

    public void completeCycle(
        long cycleId,
        Instant finishedAt,
        String status,
        String notes,
        int searchesAttempted,
        int searchesCommitted,
        int searchesFailed,
        int newListingsCount
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cycleId", cycleId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("notes", notes)
            .addValue("searchesAttempted", searchesAttempted)
            .addValue("searchesCommitted", searchesCommitted)
            .addValue("searchesFailed", searchesFailed)
            .addValue("newListingsCount", newListingsCount);
        jdbc.update(
            """
                UPDATE scrape_cycles
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    searches_attempted = :searchesAttempted,
                    searches_committed = :searchesCommitted,
                    searches_failed = :searchesFailed,
                    new_listings_count = :newListingsCount,
                    last_heartbeat_at = COALESCE(:finishedAt, last_heartbeat_at)
                WHERE id = :cycleId
                """,
            params
        );
    }

    public void insertCycleSearchResult(long cycleId, SavedSearchCycleOutcome outcome) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cycleId", cycleId)
            .addValue("savedSearchId", outcome.savedSearchId())
            .addValue("status", outcome.status().name())
            .addValue("newListingsCount", outcome.newListingCount())
            .addValue("adapterOutcomes", toJson(outcome.adapterOutcomes()))
            .addValue("finishedAt", toTimestamp(outcome.finishedAt()));
        jdbc.update(
            """
                INSERT INTO scrape_cycle_search_results (
                    cycle_id, saved_search_id, status, new_listings_count, adapter_outcomes, finished_at
                )
                VALUES (:cycleId, :savedSearchId, :status, :newListingsCount, :adapterOutcomes, :finishedAt)
                """,
            params
        );
    }

    /**
     * Closes a cycle left RUNNING by a previous process, deriving its counters from the
     * per-search rows it managed to write.
     */
    public void abortCycle(long cycleId, Instant finishedAt, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cycleId", cycleId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("notes", notes);
        jdbc.update(
            """
                UPDATE scrape_cycles
                SET finished_at = :finishedAt,
                    status = 'ABORTED',
                    notes = :notes,
                    searches_attempted = (
                        SELECT COUNT(*) FROM scrape_cycle_search_results r WHERE r.cycle_id = :cycleId
                    ),
                    searches_committed = (
                        SELECT COUNT(*) FROM scrape_cycle_search_results r
                        WHERE r.cycle_id = :cycleId AND r.status = 'COMMITTED'
                    ),
                    new_listings_count = (
                        SELECT COALESCE(SUM(r.new_listings_count), 0) FROM scrape_cycle_search_results r
                        WHERE r.cycle_id = :cycleId
                    )
                WHERE id = :cycleId
                  AND status = 'RUNNING'
                """,
            params
        );
    }

    public List<CycleRunMeta> findRunningCycles() {
        return jdbc.query(
            """
                SELECT id, started_at, finished_at, status
                FROM scrape_cycles
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            cycleMetaMapper()
        );
    }

    private RowMapper<CycleRunMeta> cycleMetaMapper() {
        return (rs, rowNum) -> new CycleRunMeta(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getString("status")
        );
    }

    private RowMapper<FeedEntryView> feedEntryMapper() {
        return (rs, rowNum) -> new FeedEntryView(
            rs.getLong("id"),
            rs.getLong("saved_search_id"),
            rs.getString("search_name"),
            MarketplaceSite.fromKey(rs.getString("site")),
            rs.getString("external_id"),
            rs.getString("title"),
            rs.getLong("price_minor"),
            rs.getString("currency"),
            rs.getString("url"),
            rs.getString("image_url"),
            toInstant(rs.getTimestamp("added_at")),
            rs.getBoolean("is_read")
        );
    }

    private SearchCriteria toCriteria(SavedSearchRow row) {
        try {
            List<String> keywords = objectMapper.readValue(row.keywordsJson(), STRING_LIST);
            Set<MarketplaceSite> sites = EnumSet.noneOf(MarketplaceSite.class);
            for (String key : objectMapper.readValue(row.sitesJson(), STRING_LIST)) {
                MarketplaceSite site = MarketplaceSite.fromKey(key);
                if (site == null) {
                    log.warn("Saved search {} references unknown site '{}'", row.id(), key);
                    continue;
                }
                sites.add(site);
            }
            return new SearchCriteria(keywords, row.minPriceMinor(), row.maxPriceMinor(), sites);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping saved search {} with invalid criteria: {}", row.id(), e.getMessage());
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize adapter outcomes", e);
        }
    }

    private MapSqlParameterSource keyParams(long savedSearchId, ListingKey key, Instant seenAt) {
        return new MapSqlParameterSource()
            .addValue("savedSearchId", savedSearchId)
            .addValue("site", key.site().key())
            .addValue("externalId", key.externalId())
            .addValue("firstSeenAt", toTimestamp(seenAt));
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private record SavedSearchRow(
        long id,
        String name,
        String keywordsJson,
        Long minPriceMinor,
        Long maxPriceMinor,
        String sitesJson,
        boolean notificationsEnabled,
        Instant lastCycleAt,
        long snapshotVersion
    ) {
    }
}
