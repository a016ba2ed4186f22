package com.careerpilot.backend.profile.persistence;

import com.careerpilot.backend.profile.domain.Resume;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ResumeRepository extends JpaRepository<Resume, UUID> {

  List<Resume> findTop5ByUserIdOrderByCreatedAtDesc(String userId);
}
