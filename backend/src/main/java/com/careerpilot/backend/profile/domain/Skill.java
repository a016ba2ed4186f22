package com.careerpilot.backend.profile.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "skills")
public class Skill {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "category")
  private String category;

  protected Skill() {}

  public Skill(String name, String category) {
    this.name = name;
    this.category = category;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getCategory() {
    return category;
  }
}
