package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves who owns a turn. Explicit request values win; missing values are taken from the
 * metadata of the latest inbound message that carries them.
 */
@Component
public class IdentityResolver {

  public static final String USER_ID_KEY = "user_id";
  public static final String THREAD_ID_KEY = "thread_id";

  public Optional<ThreadIdentity> resolve(
      String userId, String threadId, List<ConversationMessage> inboundMessages) {
    String resolvedUser =
        StringUtils.hasText(userId) ? userId : latestMetadata(inboundMessages, USER_ID_KEY);
    String resolvedThread =
        StringUtils.hasText(threadId) ? threadId : latestMetadata(inboundMessages, THREAD_ID_KEY);
    if (!StringUtils.hasText(resolvedUser) || !StringUtils.hasText(resolvedThread)) {
      return Optional.empty();
    }
    return Optional.of(new ThreadIdentity(resolvedUser, resolvedThread));
  }

  private static String latestMetadata(List<ConversationMessage> messages, String key) {
    if (messages == null) {
      return null;
    }
    for (int index = messages.size() - 1; index >= 0; index--) {
      ConversationMessage message = messages.get(index);
      if (message == null) {
        continue;
      }
      String value = message.metadataValue(key);
      if (StringUtils.hasText(value)) {
        return value;
      }
    }
    return null;
  }
}
