package ca.carms.residency.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the disciplines table.
 * Static lookup; the id comes from the source data.
 */
@Entity
@Table(name = "disciplines")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Discipline {

    @Id
    @Column(name = "discipline_id")
    private Integer id;

    @Column(name = "discipline", nullable = false, columnDefinition = "TEXT")
    private String name;
}
