package com.careerpilot.backend.chat.persistence;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserJobRepository extends JpaRepository<UserJob, UUID> {

  List<UserJob> findTop20ByUserIdOrderByCreatedAtDesc(String userId);
}
