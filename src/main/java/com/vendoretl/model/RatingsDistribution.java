package com.vendoretl.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * How a vendor's ratings spread over the 1-5 star scores, as reported by the reviews service.
 */
@Value
@Builder
public class RatingsDistribution {
    int totalCount;
    String createdAt;
    String updatedAt;
    @Singular
    List<Score> scores;

    @Value
    public static class Score {
        int score;
        int count;
        int percentage;
    }
}
