package com.careerpilot.backend.profile.persistence;

import com.careerpilot.backend.profile.domain.UserSkill;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserSkillRepository extends JpaRepository<UserSkill, UUID> {

  @EntityGraph(attributePaths = "skill")
  List<UserSkill> findByUserId(String userId);
}
