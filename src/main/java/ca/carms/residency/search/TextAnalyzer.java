package ca.carms.residency.search;

import ca.carms.residency.entity.SectionTerm;
import opennlp.tools.stemmer.snowball.SnowballStemmer;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * English text analysis backing the section search index: OpenNLP simple
 * tokenization, lower-casing, English stop-word removal and Snowball stemming.
 * The same chain is applied to indexed text and to queries. Tokens longer
 * than {@link SectionTerm#MAX_TERM_LENGTH} are dropped.
 */
@Component
public class TextAnalyzer {

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "but", "by", "for", "if", "in", "into", "is", "it",
        "no", "not", "of", "on", "or", "s", "such", "t", "that", "the", "their", "then", "there",
        "these", "they", "this", "to", "was", "will", "with");

    private final SimpleTokenizer tokenizer = SimpleTokenizer.INSTANCE;

    // stemmers keep per-call state
    private final ThreadLocal<SnowballStemmer> stemmerLocal =
        ThreadLocal.withInitial(() -> new SnowballStemmer(SnowballStemmer.ALGORITHM.ENGLISH));

    public List<AnalyzedToken> tokens(String text) {
        List<AnalyzedToken> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        SnowballStemmer stemmer = stemmerLocal.get();
        for (Span span : tokenizer.tokenizePos(text)) {
            String word = span.getCoveredText(text).toString().toLowerCase(Locale.ROOT);
            if (word.length() > SectionTerm.MAX_TERM_LENGTH || !isWord(word) || STOP_WORDS.contains(word)) {
                continue;
            }
            String term = stemmer.stem(word).toString();
            tokens.add(new AnalyzedToken(term.isEmpty() ? word : term, span.getStart(), span.getEnd()));
        }
        return tokens;
    }

    /**
     * Term frequencies of a text, sorted by term.
     */
    public Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> frequencies = new TreeMap<>();
        for (AnalyzedToken token : tokens(text)) {
            frequencies.merge(token.getTerm(), 1, Integer::sum);
        }
        return frequencies;
    }

    /**
     * Distinct terms of a query in the order they appear.
     */
    public Set<String> queryTerms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        for (AnalyzedToken token : tokens(query)) {
            terms.add(token.getTerm());
        }
        return terms;
    }

    private static boolean isWord(String token) {
        return token.chars().anyMatch(Character::isLetterOrDigit);
    }
}
