package com.careerpilot.backend.chat.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

/** Job saved for a user. Rows are only ever inserted. */
@Entity
@Table(name = "user_jobs")
public class UserJob {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "user_id", nullable = false, length = 64)
  private String userId;

  @Column(name = "job_title", nullable = false)
  private String jobTitle;

  @Column(name = "company", nullable = false)
  private String company;

  @Column(name = "location")
  private String location;

  @Column(name = "match_rating", nullable = false)
  private Integer matchRating;

  @Column(name = "link", columnDefinition = "TEXT")
  private String link;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected UserJob() {}

  public UserJob(
      String userId,
      String jobTitle,
      String company,
      String location,
      Integer matchRating,
      String link) {
    this.userId = userId;
    this.jobTitle = jobTitle;
    this.company = company;
    this.location = location;
    this.matchRating = matchRating;
    this.link = link;
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

  public String getJobTitle() {
    return jobTitle;
  }

  public String getCompany() {
    return company;
  }

  public String getLocation() {
    return location;
  }

  public Integer getMatchRating() {
    return matchRating;
  }

  public String getLink() {
    return link;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
