package com.hrintake.telegram.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Submitted applications. Queries return newest first and may throw {@link
 * org.springframework.dao.DataAccessException}; {@link #save} never throws.
 */
public interface ApplicationStore {

  boolean isAvailable();

  /** Saves with bounded retries. Empty when the store is unavailable or every attempt failed. */
  Optional<String> save(ApplicationDraft draft);

  Optional<StoredApplication> findById(String id);

  List<StoredApplication> findRecent(int limit);

  List<StoredApplication> findCreatedSince(Instant since, int limit);
}
