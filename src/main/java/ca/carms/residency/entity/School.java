package ca.carms.residency.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the schools table.
 */
@Entity
@Table(name = "schools")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class School {

    @Id
    @Column(name = "school_id")
    private Integer id;

    @Column(name = "school_name", nullable = false, columnDefinition = "TEXT")
    private String name;
}
