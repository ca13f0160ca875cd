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

import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for the program_description_sections table.
 * One named text block of a program description, pivoted out of the wide
 * x_section columns.
 */
@Entity
@Table(name = "program_description_sections", indexes = {
    @Index(name = "idx_sections_description", columnList = "program_description_id"),
    @Index(name = "idx_sections_name", columnList = "section_name")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_sections_description_name",
        columnNames = {"program_description_id", "section_name"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgramDescriptionSection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "program_description_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ProgramDescription description;

    @Convert(converter = SectionNameConverter.class)
    @Column(name = "section_name", nullable = false, length = 64)
    private SectionName sectionName;

    @Column(name = "section_text", columnDefinition = "TEXT")
    private String sectionText;

    @OneToMany(mappedBy = "section", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<SectionTerm> terms = new ArrayList<>();

    /**
     * Helper method to add an index term to this section
     */
    public void addTerm(SectionTerm term) {
        terms.add(term);
        term.setSection(this);
    }
}
