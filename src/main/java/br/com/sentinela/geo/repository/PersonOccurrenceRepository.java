package br.com.sentinela.geo.repository;

import br.com.sentinela.geo.model.PersonOccurrenceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface PersonOccurrenceRepository extends JpaRepository<PersonOccurrenceEntity, Long> {

    List<PersonOccurrenceEntity> findByArticleUrlOrderByStartOffset(String articleUrl);

    @Modifying
    @Query(value =
        "INSERT INTO person_occurrences (person_id, article_url, start_offset, end_offset, surface, phrase, " +
        "method, confidence, updated_at) " +
        "VALUES (:personId, :articleUrl, :startOffset, :endOffset, :surface, :phrase, :method, :confidence, :updatedAt) " +
        "ON CONFLICT (article_url, start_offset, end_offset) DO UPDATE SET " +
        "person_id = EXCLUDED.person_id, " +
        "surface = EXCLUDED.surface, " +
        "phrase = EXCLUDED.phrase, " +
        "method = EXCLUDED.method, " +
        "confidence = EXCLUDED.confidence, " +
        "updated_at = EXCLUDED.updated_at",
        nativeQuery = true)
    int upsertOccurrence(
        @Param("personId") Long personId,
        @Param("articleUrl") String articleUrl,
        @Param("startOffset") int startOffset,
        @Param("endOffset") int endOffset,
        @Param("surface") String surface,
        @Param("phrase") String phrase,
        @Param("method") String method,
        @Param("confidence") double confidence,
        @Param("updatedAt") Instant updatedAt);
}
