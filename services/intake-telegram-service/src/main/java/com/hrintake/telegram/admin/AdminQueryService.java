package com.hrintake.telegram.admin;

import com.hrintake.telegram.store.ApplicationStore;
import com.hrintake.telegram.store.StoredApplication;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Read side of the admin console. Store failures are logged and turn into empty answers. */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdminQueryService {

  private final ApplicationStore store;
  private final Clock clock;

  public boolean isStoreAvailable() {
    return store.isAvailable();
  }

  /**
   * Page of the newest applications starting at {@code offset}. An offset past the last record
   * resolves to the last non-empty page within the same store query.
   */
  public AdminResult<RecentPage> listRecent(int limit, int offset) {
    if (!store.isAvailable()) {
      return AdminResult.unavailable();
    }
    int from = (int) Math.min(Math.max(0, offset), (long) Integer.MAX_VALUE - limit);
    List<StoredApplication> window;
    try {
      window = store.findRecent(from + limit);
    } catch (DataAccessException e) {
      log.error("Failed to list recent applications (offset={}): {}", from, e.getMessage());
      return AdminResult.of(new RecentPage(List.of(), from, limit, false));
    }

    if (window.size() > from) {
      List<StoredApplication> items = List.copyOf(window.subList(from, window.size()));
      return AdminResult.of(new RecentPage(items, from, limit, items.size() == limit));
    }
    if (window.isEmpty()) {
      return AdminResult.of(new RecentPage(List.of(), 0, limit, false));
    }
    int last = (window.size() - 1) / limit * limit;
    log.debug("Offset {} is past {} applications, showing offset {}", from, window.size(), last);
    return AdminResult.of(
        new RecentPage(List.copyOf(window.subList(last, window.size())), last, limit, false));
  }

  public AdminResult<List<StoredApplication>> searchByPosition(
      String query, int limit, int scanLimit) {
    if (!store.isAvailable()) {
      return AdminResult.unavailable();
    }
    String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    if (q.isEmpty()) {
      return AdminResult.of(List.of());
    }

    List<StoredApplication> matches = new ArrayList<>();
    try {
      for (StoredApplication app : store.findRecent(scanLimit)) {
        String position = app.position() == null ? "" : app.position();
        if (position.toLowerCase(Locale.ROOT).contains(q)) {
          matches.add(app);
        }
        if (matches.size() >= limit) {
          break;
        }
      }
    } catch (DataAccessException e) {
      log.error("Failed to search applications by '{}': {}", q, e.getMessage());
      return AdminResult.of(List.of());
    }
    return AdminResult.of(matches);
  }

  public AdminResult<PositionStats> positionStats(int days, int limit) {
    if (!store.isAvailable()) {
      return AdminResult.unavailable();
    }
    Instant since = clock.instant().minus(Duration.ofDays(days));
    List<StoredApplication> window;
    try {
      window = store.findCreatedSince(since, limit);
    } catch (DataAccessException e) {
      log.error("Failed to collect position stats for {} days: {}", days, e.getMessage());
      window = List.of();
    }

    Map<String, Long> counts = new HashMap<>();
    for (StoredApplication app : window) {
      String position =
          app.position() == null || app.position().isBlank()
              ? PositionStats.UNKNOWN
              : app.position();
      counts.merge(position, 1L, Long::sum);
    }
    Map<String, Long> sorted = new LinkedHashMap<>();
    counts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
        .forEach(e -> sorted.put(e.getKey(), e.getValue()));
    return AdminResult.of(new PositionStats(days, window.size(), sorted));
  }

  public AdminResult<Optional<StoredApplication>> getApplication(String id) {
    if (!store.isAvailable()) {
      return AdminResult.unavailable();
    }
    try {
      return AdminResult.of(store.findById(id));
    } catch (DataAccessException e) {
      log.error("Failed to load application {}: {}", id, e.getMessage());
      return AdminResult.of(Optional.empty());
    }
  }
}
