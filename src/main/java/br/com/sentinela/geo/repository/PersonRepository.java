package br.com.sentinela.geo.repository;

import br.com.sentinela.geo.model.PersonEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PersonRepository extends JpaRepository<PersonEntity, Long> {

    Optional<PersonEntity> findByCanonicalName(String canonicalName);

    // Cria a pessoa ou junta os apelidos novos aos existentes; devolve o id em ambos os casos
    @Query(value =
        "INSERT INTO persons (canonical_name, aliases) VALUES (:canonicalName, :aliases) " +
        "ON CONFLICT (canonical_name) DO UPDATE SET aliases = (" +
        "   SELECT string_agg(DISTINCT a, '|' ORDER BY a) " +
        "   FROM unnest(string_to_array(concat_ws('|', persons.aliases, EXCLUDED.aliases), '|')) AS a " +
        "   WHERE a <> ''" +
        ") " +
        "RETURNING id", nativeQuery = true)
    Long upsertPerson(@Param("canonicalName") String canonicalName, @Param("aliases") String aliases);
}
