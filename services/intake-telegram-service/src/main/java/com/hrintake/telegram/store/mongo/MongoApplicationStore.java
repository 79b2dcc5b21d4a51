package com.hrintake.telegram.store.mongo;

import com.hrintake.telegram.config.StoreProperties;
import com.hrintake.telegram.model.Attachment;
import com.hrintake.telegram.store.ApplicationDraft;
import com.hrintake.telegram.store.ApplicationStore;
import com.hrintake.telegram.store.DocumentStoreStatus;
import com.hrintake.telegram.store.StoredApplication;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class MongoApplicationStore implements ApplicationStore {

  private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

  private final ApplicationMongoRepository repository;
  private final DocumentStoreStatus status;
  private final StoreProperties properties;

  public MongoApplicationStore(
      ApplicationMongoRepository repository,
      DocumentStoreStatus status,
      StoreProperties properties) {
    this.repository = repository;
    this.status = status;
    this.properties = properties;
  }

  @Override
  public boolean isAvailable() {
    return status.isAvailable();
  }

  @Override
  public Optional<String> save(ApplicationDraft draft) {
    if (!isAvailable()) {
      return Optional.empty();
    }
    int attempts = properties.saveAttempts();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        ApplicationDocument saved = repository.save(toDocument(draft));
        return Optional.ofNullable(saved.getId());
      } catch (DataAccessException e) {
        log.error(
            "Failed to save application of user {} (attempt {}/{}): {}",
            draft.userId(),
            attempt,
            attempts,
            e.getMessage());
        if (attempt < attempts && !pause(attempt)) {
          break;
        }
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<StoredApplication> findById(String id) {
    if (id == null || id.isBlank()) {
      return Optional.empty();
    }
    return repository.findById(id.trim()).map(this::toApplication);
  }

  @Override
  public List<StoredApplication> findRecent(int limit) {
    return repository.findAll(page(limit)).getContent().stream().map(this::toApplication).toList();
  }

  @Override
  public List<StoredApplication> findCreatedSince(Instant since, int limit) {
    return repository.findByCreatedAtGreaterThanEqual(since, page(limit)).stream()
        .map(this::toApplication)
        .toList();
  }

  private static Pageable page(int limit) {
    return PageRequest.of(0, Math.max(1, limit), NEWEST_FIRST);
  }

  private boolean pause(int attempt) {
    try {
      Thread.sleep(properties.saveBackoff().multipliedBy(attempt).toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private StoredApplication toApplication(ApplicationDocument doc) {
    return new StoredApplication(
        doc.getId(),
        doc.getUserId(),
        doc.getName(),
        doc.getPhone(),
        doc.getPosition(),
        doc.getExperience(),
        Attachment.of(doc.getCvFileId(), doc.getCvType()),
        doc.getCreatedAt());
  }

  private ApplicationDocument toDocument(ApplicationDraft draft) {
    ApplicationDocument doc = new ApplicationDocument();
    doc.setUserId(draft.userId());
    doc.setName(draft.name());
    doc.setPhone(draft.phone());
    doc.setPosition(draft.position());
    doc.setExperience(draft.experience());
    if (draft.attachment() != null) {
      doc.setCvFileId(draft.attachment().fileId());
      doc.setCvType(draft.attachment().kind().code());
    }
    return doc;
  }
}
