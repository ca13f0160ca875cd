package ca.carms.residency.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Result-size bounds for the read API (carms.query.* in application.yml).
 */
@Data
@ConfigurationProperties(prefix = "carms.query")
public class QueryProperties {

    private int defaultLimit = 20;

    private int maxLimit = 200;

    private int searchDefaultLimit = 20;

    private int searchMaxLimit = 100;

    /** Characters of context kept on each side of the first hit in a search snippet. */
    private int snippetRadius = 80;
}
