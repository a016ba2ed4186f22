package com.careerpilot.backend.profile.persistence;

import com.careerpilot.backend.profile.domain.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserProfileRepository extends JpaRepository<UserProfile, String> {}
