package com.careerpilot.backend.profile.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "profiles")
public class UserProfile {

  @Id
  @Column(name = "id", length = 64)
  private String id;

  @Column(name = "full_name")
  private String fullName;

  @Column(name = "linkedin_url")
  private String linkedinUrl;

  protected UserProfile() {}

  public UserProfile(String id, String fullName, String linkedinUrl) {
    this.id = id;
    this.fullName = fullName;
    this.linkedinUrl = linkedinUrl;
  }

  public String getId() {
    return id;
  }

  public String getFullName() {
    return fullName;
  }

  public String getLinkedinUrl() {
    return linkedinUrl;
  }
}
