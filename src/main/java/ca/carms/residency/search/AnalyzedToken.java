package ca.carms.residency.search;

import lombok.Value;

/**
 * A stemmed term and the character span it came from.
 */
@Value
public class AnalyzedToken {
    String term;
    int startOffset;
    int endOffset;
}
