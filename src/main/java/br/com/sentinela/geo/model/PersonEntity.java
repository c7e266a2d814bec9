package br.com.sentinela.geo.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "persons")
public class PersonEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "canonical_name", nullable = false, unique = true, columnDefinition = "TEXT")
    private String canonicalName;

    // Apelidos separados por '|'
    @Column(columnDefinition = "TEXT")
    private String aliases;
}
