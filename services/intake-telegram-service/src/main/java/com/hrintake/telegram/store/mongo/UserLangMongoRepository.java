package com.hrintake.telegram.store.mongo;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface UserLangMongoRepository extends MongoRepository<UserLangDocument, String> {}
