package com.careerpilot.backend.profile.service;

import com.careerpilot.backend.profile.domain.UserProfile;
import com.careerpilot.backend.profile.domain.UserSkill;
import com.careerpilot.backend.profile.persistence.UserProfileRepository;
import com.careerpilot.backend.profile.persistence.UserSkillRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class ProfileUserContextProvider implements UserContextProvider {

  private static final Logger log = LoggerFactory.getLogger(ProfileUserContextProvider.class);

  private final UserProfileRepository userProfileRepository;
  private final UserSkillRepository userSkillRepository;
  private final UserContextFormatter formatter;

  public ProfileUserContextProvider(
      UserProfileRepository userProfileRepository,
      UserSkillRepository userSkillRepository,
      UserContextFormatter formatter) {
    this.userProfileRepository = userProfileRepository;
    this.userSkillRepository = userSkillRepository;
    this.formatter = formatter;
  }

  @Override
  @Transactional(readOnly = true)
  public String fetchUserContext(String userId) {
    if (!StringUtils.hasText(userId)) {
      return NO_CONTEXT;
    }
    UserProfile profile = userProfileRepository.findById(userId).orElse(null);
    List<UserSkill> skills = userSkillRepository.findByUserId(userId);
    String context = formatter.format(profile, skills);
    if (log.isDebugEnabled()) {
      log.debug(
          "Built user context for {} from profile={} and {} skill(s)",
          userId,
          profile != null,
          skills.size());
    }
    return context;
  }
}
