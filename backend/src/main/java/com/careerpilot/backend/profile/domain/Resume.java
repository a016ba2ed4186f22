package com.careerpilot.backend.profile.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "resumes")
public class Resume {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "user_id", nullable = false, length = 64)
  private String userId;

  @Column(name = "profile", columnDefinition = "TEXT")
  private String profile;

  @Column(name = "linkedin")
  private String linkedin;

  @Column(name = "skills", columnDefinition = "TEXT")
  private String skills;

  @Column(name = "experience", columnDefinition = "TEXT")
  private String experience;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Resume() {}

  public Resume(String userId, String profile, String linkedin, String skills, String experience) {
    this.userId = userId;
    this.profile = profile;
    this.linkedin = linkedin;
    this.skills = skills;
    this.experience = experience;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public String getProfile() {
    return profile;
  }

  public String getLinkedin() {
    return linkedin;
  }

  public String getSkills() {
    return skills;
  }

  public String getExperience() {
    return experience;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
