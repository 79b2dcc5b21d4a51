package com.hrintake.telegram.store;

import com.hrintake.telegram.model.Attachment;
import java.time.Instant;

public record StoredApplication(
    String id,
    String userId,
    String name,
    String phone,
    String position,
    String experience,
    Attachment attachment,
    Instant createdAt) {}
