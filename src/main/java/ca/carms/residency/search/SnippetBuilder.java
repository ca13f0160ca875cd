package ca.carms.residency.search;

import java.util.List;
import java.util.Set;

/**
 * Builds a short excerpt around the first query hit, with every hit inside the
 * excerpt wrapped in {@code <b>...</b>}.
 */
public final class SnippetBuilder {

    private static final String ELLIPSIS = "...";

    private SnippetBuilder() {
    }

    public static String snippet(String text, List<AnalyzedToken> tokens, Set<String> queryTerms, int radius) {
        if (text == null) {
            return null;
        }
        List<AnalyzedToken> hits = tokens.stream()
            .filter(token -> queryTerms.contains(token.getTerm()))
            .toList();
        if (hits.isEmpty()) {
            return text.length() <= 2 * radius ? text : text.substring(0, 2 * radius).strip() + ELLIPSIS;
        }

        AnalyzedToken first = hits.get(0);
        int start = Math.max(0, first.getStartOffset() - radius);
        int end = Math.min(text.length(), first.getEndOffset() + radius);

        StringBuilder snippet = new StringBuilder();
        if (start > 0) {
            snippet.append(ELLIPSIS);
        }
        int cursor = start;
        for (AnalyzedToken hit : hits) {
            if (hit.getStartOffset() < cursor || hit.getEndOffset() > end) {
                continue;
            }
            snippet.append(text, cursor, hit.getStartOffset())
                .append("<b>")
                .append(text, hit.getStartOffset(), hit.getEndOffset())
                .append("</b>");
            cursor = hit.getEndOffset();
        }
        snippet.append(text, cursor, end);
        if (end < text.length()) {
            snippet.append(ELLIPSIS);
        }
        return snippet.toString();
    }
}
