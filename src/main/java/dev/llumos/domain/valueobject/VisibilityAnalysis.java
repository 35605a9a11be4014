package dev.llumos.domain.valueobject;

import java.util.List;

/**
 * Brand visibility extracted from one answer. Score is on a 1-10 scale;
 * prominence is null when the org brand is absent.
 */
public record VisibilityAnalysis(double score, boolean orgBrandPresent, Integer prominence,
                                 List<String> brands, List<String> competitors) {
    public VisibilityAnalysis {
        if (score < 1 || score > 10) throw new IllegalArgumentException("score out of range: " + score);
        brands = brands == null ? List.of() : List.copyOf(brands);
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
    }
}
