package com.careerpilot.backend.chat.context;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.ModelType;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

public class EncodingTokenEstimator implements TokenEstimator {

  private static final Logger log = LoggerFactory.getLogger(EncodingTokenEstimator.class);

  private final Encoding encoding;
  private final int messageOverhead;

  public EncodingTokenEstimator(
      EncodingRegistry encodingRegistry, String tokenizer, int messageOverhead) {
    String tokenizerName = StringUtils.hasText(tokenizer) ? tokenizer.trim() : "cl100k_base";
    this.encoding = resolveEncoding(encodingRegistry, tokenizerName);
    this.messageOverhead = Math.max(0, messageOverhead);
  }

  @Override
  public int estimate(ConversationMessage message) {
    if (message == null) {
      return 0;
    }
    return messageOverhead + countTokens(message.content());
  }

  private int countTokens(String text) {
    if (!StringUtils.hasText(text)) {
      return 0;
    }
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException ordinaryFailure) {
      log.debug("Falling back to strict token counting due to {}", ordinaryFailure.getMessage());
      return encoding.countTokens(text);
    }
  }

  private static Encoding resolveEncoding(EncodingRegistry registry, String tokenizerName) {
    Optional<Encoding> encoding = registry.getEncodingForModel(tokenizerName);
    if (encoding.isEmpty()) {
      encoding = ModelType.fromName(tokenizerName).map(registry::getEncodingForModel);
    }
    if (encoding.isEmpty()) {
      encoding = EncodingType.fromName(tokenizerName).map(registry::getEncoding);
    }
    if (encoding.isEmpty()) {
      encoding = registry.getEncoding(tokenizerName);
    }
    return encoding.orElseThrow(
        () ->
            new IllegalArgumentException(
                "Unknown tokenizer '" + tokenizerName + "', configure a supported tokenizer"));
  }
}
