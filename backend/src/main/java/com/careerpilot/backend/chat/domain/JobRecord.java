package com.careerpilot.backend.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Job posting recovered from capability output. Ratings are always within {@code [0, 5]}. */
public record JobRecord(
    @JsonProperty("job_title") String jobTitle,
    @JsonProperty("company") String company,
    @JsonProperty("location") String location,
    @JsonProperty("match_rating") int matchRating,
    @JsonProperty("link") String link) {

  public static final int MIN_RATING = 0;
  public static final int MAX_RATING = 5;

  public static boolean isValidRating(long rating) {
    return rating >= MIN_RATING && rating <= MAX_RATING;
  }
}
