package com.careerpilot.backend.profile.service;

import com.careerpilot.backend.profile.domain.UserProfile;
import com.careerpilot.backend.profile.domain.UserSkill;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class UserContextFormatter {

  private static final String UNKNOWN = "Unknown";

  public String format(UserProfile profile, List<UserSkill> skills) {
    List<String> parts = new ArrayList<>();
    if (profile != null) {
      if (StringUtils.hasText(profile.getFullName())) {
        parts.add("Name: " + profile.getFullName().trim());
      }
      if (StringUtils.hasText(profile.getLinkedinUrl())) {
        parts.add("LinkedIn: " + profile.getLinkedinUrl().trim());
      }
    }
    String skillLine = formatSkills(skills);
    if (StringUtils.hasText(skillLine)) {
      parts.add("Skills: " + skillLine);
    }
    if (parts.isEmpty()) {
      return UserContextProvider.NO_CONTEXT;
    }
    return String.join(". ", parts) + ".";
  }

  private String formatSkills(List<UserSkill> skills) {
    if (skills == null || skills.isEmpty()) {
      return "";
    }
    StringJoiner joiner = new StringJoiner(", ");
    for (UserSkill userSkill : skills) {
      if (userSkill == null) {
        continue;
      }
      String name =
          userSkill.getSkill() != null && StringUtils.hasText(userSkill.getSkill().getName())
              ? userSkill.getSkill().getName()
              : UNKNOWN;
      String proficiency =
          StringUtils.hasText(userSkill.getProficiencyLevel())
              ? userSkill.getProficiencyLevel()
              : UNKNOWN;
      joiner.add(name + " (" + proficiency + ")");
    }
    return joiner.toString();
  }
}
