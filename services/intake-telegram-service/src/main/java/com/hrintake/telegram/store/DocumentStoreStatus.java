package com.hrintake.telegram.store;

import com.hrintake.telegram.config.StoreProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Whether the document store answered at startup. Everything that depends on it degrades to
 * memory-only or "store unavailable" when it did not.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentStoreStatus {

  private final MongoTemplate mongo;
  private final StoreProperties properties;
  private volatile boolean available;

  @PostConstruct
  void probe() {
    if (!properties.enabled()) {
      log.warn("Document store disabled (bot.store.enabled=false); running memory-only");
      return;
    }
    try {
      mongo.executeCommand(new Document("ping", 1));
      available = true;
      log.info("Document store connected, database={}", mongo.getDb().getName());
    } catch (DataAccessException e) {
      log.error("Document store is not reachable, running memory-only: {}", e.getMessage());
    }
  }

  public boolean isAvailable() {
    return available;
  }
}
