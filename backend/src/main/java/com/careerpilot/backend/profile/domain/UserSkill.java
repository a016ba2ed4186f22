package com.careerpilot.backend.profile.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "user_skills")
public class UserSkill {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "user_id", nullable = false, length = 64)
  private String userId;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "skill_id")
  private Skill skill;

  @Column(name = "proficiency_level", length = 64)
  private String proficiencyLevel;

  protected UserSkill() {}

  public UserSkill(String userId, Skill skill, String proficiencyLevel) {
    this.userId = userId;
    this.skill = skill;
    this.proficiencyLevel = proficiencyLevel;
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public Skill getSkill() {
    return skill;
  }

  public String getProficiencyLevel() {
    return proficiencyLevel;
  }
}
