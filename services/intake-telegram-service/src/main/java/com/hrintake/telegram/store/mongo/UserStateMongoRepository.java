package com.hrintake.telegram.store.mongo;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface UserStateMongoRepository extends MongoRepository<UserStateDocument, String> {}
