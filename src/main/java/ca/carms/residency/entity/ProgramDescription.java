package ca.carms.residency.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JPA Entity for the program_descriptions table.
 * The free-text document attached to exactly one program stream, joined on
 * {@code source_url = program_streams.program_url}.
 */
@Entity
@Table(name = "program_descriptions", uniqueConstraints = {
    @UniqueConstraint(name = "uk_program_descriptions_stream", columnNames = "program_stream_id"),
    @UniqueConstraint(name = "uk_program_descriptions_source_url", columnNames = "source_url")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgramDescription {

    @Id
    @Column(name = "program_description_id")
    private Integer id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "program_stream_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ProgramStream programStream;

    @Column(name = "source_url", nullable = false, length = 1024)
    private String sourceUrl;

    @Column(name = "document_id", columnDefinition = "TEXT")
    private String documentId;

    @Column(name = "match_iteration_id")
    private Integer matchIterationId;

    @Column(name = "match_iteration_name", columnDefinition = "TEXT")
    private String matchIterationName;

    @Column(name = "program_name", columnDefinition = "TEXT")
    private String programName;

    @Column(name = "n_program_description_sections")
    private Integer sectionCount;

    @OneToMany(mappedBy = "description", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<ProgramDescriptionSection> sections = new ArrayList<>();

    /**
     * Helper method to add a section to this description
     */
    public void addSection(ProgramDescriptionSection section) {
        sections.add(section);
        section.setDescription(this);
    }

    /**
     * Detach a section; orphan removal deletes it on flush
     */
    public void removeSection(ProgramDescriptionSection section) {
        sections.remove(section);
    }

    public Optional<ProgramDescriptionSection> findSection(SectionName name) {
        return sections.stream()
            .filter(section -> section.getSectionName() == name)
            .findFirst();
    }
}
