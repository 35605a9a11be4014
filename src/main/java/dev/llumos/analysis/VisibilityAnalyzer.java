package dev.llumos.analysis;

import dev.llumos.domain.valueobject.VisibilityAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores how visible the organization's brand is in one AI answer.
 *
 * <pre>
 *  brand found:     6
 *                   + 3 / 2 / 1 when prominence >= 8 / 6 / 4
 *                   - 2 / 1     when more than 8 / 4 competitors are named
 *  brand not found: 2 for answers over 500 characters, else 1
 * </pre>
 * Prominence is {@code ceil((1 - firstPosition / length) * 10)}: 10 for a mention at the very
 * start, 1 near the end. The score is clamped to 1..10.
 */
@Component
public class VisibilityAnalyzer {

    private static final int LONG_ANSWER_CHARS = 500;

    public VisibilityAnalysis analyze(String answer, BrandProfile profile) {
        String text = answer == null ? "" : answer;

        OptionalInt firstOrgMention = OptionalInt.empty();
        List<String> brandsFound = new ArrayList<>();
        for (Map.Entry<String, List<String>> brand : profile.orgBrands().entrySet()) {
            OptionalInt pos = firstMention(text, brand.getValue());
            if (pos.isPresent()) {
                brandsFound.add(brand.getKey());
                if (firstOrgMention.isEmpty() || pos.getAsInt() < firstOrgMention.getAsInt()) firstOrgMention = pos;
            }
        }

        List<String> competitorsFound = new ArrayList<>();
        for (Map.Entry<String, List<String>> competitor : profile.competitors().entrySet()) {
            if (isOwnBrandName(competitor.getKey(), profile)) continue;
            if (firstMention(text, competitor.getValue()).isPresent()) competitorsFound.add(competitor.getKey());
        }

        if (firstOrgMention.isEmpty()) {
            double score = text.length() > LONG_ANSWER_CHARS ? 2 : 1;
            return new VisibilityAnalysis(score, false, null, brandsFound, competitorsFound);
        }

        int prominence = prominence(firstOrgMention.getAsInt(), text.length());
        double score = 6;
        if (prominence >= 8) score += 3;
        else if (prominence >= 6) score += 2;
        else if (prominence >= 4) score += 1;

        if (competitorsFound.size() > 8) score -= 2;
        else if (competitorsFound.size() > 4) score -= 1;

        return new VisibilityAnalysis(clamp(score), true, prominence, brandsFound, competitorsFound);
    }

    static int prominence(int position, int length) {
        if (length <= 0) return 10;
        double ratio = (double) position / length;
        int value = (int) Math.ceil((1 - ratio) * 10);
        return Math.max(1, Math.min(10, value));
    }

    private static OptionalInt firstMention(String text, List<String> terms) {
        int best = -1;
        for (String term : terms) {
            Matcher m = termPattern(term).matcher(text);
            if (m.find() && (best < 0 || m.start() < best)) best = m.start();
        }
        return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }

    // whole-term match: no letter or digit directly before or after
    private static Pattern termPattern(String term) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(term.trim()) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static boolean isOwnBrandName(String name, BrandProfile profile) {
        String lower = name.toLowerCase(Locale.ROOT);
        return profile.orgBrands().values().stream()
                .flatMap(List::stream)
                .anyMatch(term -> term.toLowerCase(Locale.ROOT).equals(lower));
    }

    private static double clamp(double score) {
        return Math.max(1, Math.min(10, score));
    }
}
