package com.careerpilot.backend.chat.state;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import java.util.List;

/** Source of the stored messages of a thread, oldest first. */
@FunctionalInterface
public interface ConversationHistoryLoader {

  List<ConversationMessage> load(ThreadIdentity identity);
}
