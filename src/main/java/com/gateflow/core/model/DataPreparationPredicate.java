package com.gateflow.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether the data preparation gate runs for a request.
 * <p>
 * The gate fires when the request declares data-driven mode, or when its text uses
 * multiplicity vocabulary (terms denoting repetition or variation) and the feature is
 * big enough to benefit: more than two acceptance criteria, or at least three input
 * fields on the page.
 * <p>
 * Pure function of the request and the cached page content.
 */
public final class DataPreparationPredicate {

    static final int MIN_CRITERIA_EXCLUSIVE = 2;
    static final int MIN_INPUT_FIELDS = 3;

    /**
     * Multiplicity vocabulary. Single words are matched on word boundaries so that
     * e.g. "each" does not match "reach"; phrases are matched as substrings.
     */
    private static final List<String> MULTIPLICITY_TERMS = List.of(
            "multiple", "various", "different", "several", "each", "every",
            "combinations", "combination", "variations", "variation", "data-driven",
            "bulk", "batch", "repeat", "repeated", "set of", "list of", "range of");

    private static final Set<String> PHRASES = Set.of("set of", "list of", "range of", "data-driven");

    private static final Map<String, Pattern> WORD_PATTERNS = MULTIPLICITY_TERMS.stream()
            .filter(term -> !PHRASES.contains(term))
            .collect(Collectors.toUnmodifiableMap(Function.identity(),
                    term -> Pattern.compile("\\b" + Pattern.quote(term) + "\\b")));

    private DataPreparationPredicate() {} // utility class

    public static boolean evaluate(PipelineRequest request, PageContent page) {
        return decide(request, page).selected();
    }

    /**
     * Evaluates the predicate and explains the decision.
     */
    public static Decision decide(PipelineRequest request, PageContent page) {
        if (request.dataRequirements().dataDriven()) {
            return new Decision(true, "request declares data-driven mode", List.of());
        }

        List<String> matched = matchedTerms(requestText(request));
        if (matched.isEmpty()) {
            return new Decision(false, "no multiplicity vocabulary", matched);
        }

        int criteria = request.acceptanceCriteria().size();
        int inputs = page != null ? page.inputFieldCount() : 0;
        if (criteria > MIN_CRITERIA_EXCLUSIVE) {
            return new Decision(true, "multiplicity vocabulary with " + criteria + " acceptance criteria", matched);
        }
        if (inputs >= MIN_INPUT_FIELDS) {
            return new Decision(true, "multiplicity vocabulary with " + inputs + " input fields", matched);
        }
        return new Decision(false, "multiplicity vocabulary but only " + criteria
                + " acceptance criteria and " + inputs + " input fields", matched);
    }

    /**
     * Returns the multiplicity terms found in the text, in vocabulary order.
     */
    public static List<String> matchedTerms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        var matched = new ArrayList<String>();
        for (String term : MULTIPLICITY_TERMS) {
            if (matches(lower, term)) {
                matched.add(term);
            }
        }
        return matched;
    }

    private static boolean matches(String lowerText, String term) {
        if (PHRASES.contains(term)) {
            return lowerText.contains(term);
        }
        return WORD_PATTERNS.get(term).matcher(lowerText).find();
    }

    private static String requestText(PipelineRequest request) {
        var sb = new StringBuilder();
        if (request.userStory() != null) {
            sb.append(request.userStory());
        }
        for (String criterion : request.acceptanceCriteria()) {
            sb.append('\n').append(criterion);
        }
        return sb.toString();
    }

    /**
     * @param selected     whether the data preparation gate runs
     * @param reason       short explanation for logs and the audit trail
     * @param matchedTerms multiplicity terms that were found
     */
    public record Decision(boolean selected, String reason, List<String> matchedTerms) {}
}
