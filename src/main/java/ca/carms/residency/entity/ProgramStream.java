package ca.carms.residency.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA Entity for the program_streams table.
 * One residency program offering at one school. The program URL is the
 * natural key; the id is a surrogate that stays stable across reloads.
 */
@Entity
@Table(name = "program_streams", indexes = {
    @Index(name = "idx_program_streams_discipline", columnList = "discipline_id"),
    @Index(name = "idx_program_streams_school", columnList = "school_id"),
    @Index(name = "idx_program_streams_iteration", columnList = "match_iteration_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_program_streams_url", columnNames = "program_url")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgramStream {

    @Id
    @Column(name = "program_stream_id")
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "discipline_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Discipline discipline;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "school_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private School school;

    @Column(name = "program_stream_name", columnDefinition = "TEXT")
    private String streamName;

    @Column(name = "program_site", columnDefinition = "TEXT")
    private String site;

    @Column(name = "program_stream", columnDefinition = "TEXT")
    private String streamLabel;

    @Column(name = "program_name", columnDefinition = "TEXT")
    private String programName;

    @Column(name = "program_url", nullable = false, length = 1024)
    private String programUrl;

    @Column(name = "match_iteration_id", nullable = false)
    private Integer matchIterationId;
}
