package com.hrintake.telegram.store.mongo;

import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ApplicationMongoRepository extends MongoRepository<ApplicationDocument, String> {
  List<ApplicationDocument> findByCreatedAtGreaterThanEqual(Instant since, Pageable pageable);
}
