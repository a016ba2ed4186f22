package com.careerpilot.backend.chat.extraction;

/** Locates bracket-balanced substrings, ignoring brackets that appear inside JSON strings. */
final class JsonCandidateScanner {

  private JsonCandidateScanner() {}

  /**
   * Returns the index of the bracket closing the one at {@code start}, or {@code -1} when the text
   * ends first.
   */
  static int findClosing(String text, int start) {
    char open = text.charAt(start);
    char close = open == '[' ? ']' : '}';
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int index = start; index < text.length(); index++) {
      char current = text.charAt(index);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (current == '\\') {
          escaped = true;
        } else if (current == '"') {
          inString = false;
        }
        continue;
      }
      if (current == '"') {
        inString = true;
      } else if (current == open) {
        depth++;
      } else if (current == close) {
        depth--;
        if (depth == 0) {
          return index;
        }
      }
    }
    return -1;
  }
}
