package com.careerpilot.backend.profile.service;

/** Supplies the per-turn summary of who the user is. */
public interface UserContextProvider {

  String NO_CONTEXT = "No user context available";

  /**
   * Returns the formatted summary, or {@link #NO_CONTEXT} when nothing is known. May throw when the
   * underlying store is unavailable.
   */
  String fetchUserContext(String userId);
}
