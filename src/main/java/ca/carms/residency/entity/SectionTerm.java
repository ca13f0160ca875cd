package ca.carms.residency.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * JPA Entity for the section_terms table, the text-search index over
 * section_text. One row per (section, stemmed term).
 */
@Entity
@Table(name = "section_terms", indexes = {
    @Index(name = "idx_section_terms_term", columnList = "term"),
    @Index(name = "idx_section_terms_section", columnList = "section_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_section_terms_section_term", columnNames = {"section_id", "term"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionTerm {

    /**
     * Longest term the index stores; the analyzer drops longer tokens.
     */
    public static final int MAX_TERM_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "section_term_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "section_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ProgramDescriptionSection section;

    @Column(nullable = false, length = MAX_TERM_LENGTH)
    private String term;

    @Column(nullable = false)
    private Integer frequency;
}
