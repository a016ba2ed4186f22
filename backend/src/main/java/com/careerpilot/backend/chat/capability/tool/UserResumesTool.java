package com.careerpilot.backend.chat.capability.tool;

import com.careerpilot.backend.profile.domain.Resume;
import com.careerpilot.backend.profile.persistence.ResumeRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class UserResumesTool {

  private final ResumeRepository resumeRepository;

  public UserResumesTool(ResumeRepository resumeRepository) {
    this.resumeRepository = resumeRepository;
  }

  @Tool(
      name = "retrieve_existing_resumes",
      description = "Returns the most recent resumes uploaded by the current user.")
  public String retrieveExistingResumes(ToolContext toolContext) {
    Optional<String> userId = ToolContextSupport.userId(toolContext);
    if (userId.isEmpty()) {
      return "The user is not identified; no resumes are available.";
    }
    List<Resume> resumes = resumeRepository.findTop5ByUserIdOrderByCreatedAtDesc(userId.get());
    if (resumes.isEmpty()) {
      return "The user has not uploaded a resume yet.";
    }
    StringBuilder builder = new StringBuilder();
    int index = 1;
    for (Resume resume : resumes) {
      builder.append("Resume ").append(index++).append(":\n");
      appendSection(builder, "Profile", resume.getProfile());
      appendSection(builder, "LinkedIn", resume.getLinkedin());
      appendSection(builder, "Skills", resume.getSkills());
      appendSection(builder, "Experience", resume.getExperience());
      builder.append('\n');
    }
    return builder.toString().strip();
  }

  private static void appendSection(StringBuilder builder, String label, String value) {
    if (StringUtils.hasText(value)) {
      builder.append(label).append(": ").append(value.strip()).append('\n');
    }
  }
}
