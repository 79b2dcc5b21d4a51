package com.hrintake.telegram.store.mongo;

import java.time.Instant;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "applications")
public class ApplicationDocument {
  @Id private String id;
  private String userId;
  private String name;
  private String phone;
  private String position;
  private String experience;
  private String cvFileId;
  private String cvType;

  @CreatedDate @Indexed private Instant createdAt;

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getUserId() {
    return userId;
  }

  public void setUserId(String userId) {
    this.userId = userId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getPhone() {
    return phone;
  }

  public void setPhone(String phone) {
    this.phone = phone;
  }

  public String getPosition() {
    return position;
  }

  public void setPosition(String position) {
    this.position = position;
  }

  public String getExperience() {
    return experience;
  }

  public void setExperience(String experience) {
    this.experience = experience;
  }

  public String getCvFileId() {
    return cvFileId;
  }

  public void setCvFileId(String cvFileId) {
    this.cvFileId = cvFileId;
  }

  public String getCvType() {
    return cvType;
  }

  public void setCvType(String cvType) {
    this.cvType = cvType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }
}
