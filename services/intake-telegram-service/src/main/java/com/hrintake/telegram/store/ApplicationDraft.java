package com.hrintake.telegram.store;

import com.hrintake.telegram.model.Attachment;

/** A completed job application before it gets an id. {@code attachment} may be null. */
public record ApplicationDraft(
    String userId,
    String name,
    String phone,
    String position,
    String experience,
    Attachment attachment) {}
