package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.ArticleResolution;
import br.com.sentinela.geo.model.CityOccurrence;
import br.com.sentinela.geo.model.PersonOccurrence;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Destino dos resultados da extração. Ocorrências são únicas por
 * {@code (articleUrl, start, end)}: gravar de novo a mesma chave atualiza, não duplica.
 */
public interface ExtractionResultWriter {

    /**
     * @return identificador da pessoa canônica, criada se ainda não existir
     */
    String ensurePerson(String canonicalName, Set<String> aliases);

    void writeCityOccurrence(CityOccurrence occurrence);

    void writePersonOccurrence(String personId, PersonOccurrence occurrence);

    /**
     * Grava tudo o que foi resolvido para um artigo. Implementações transacionais devem
     * gravar o artigo inteiro ou nada.
     */
    default void writeArticle(ArticleResolution resolution) {
        Map<String, String> personIds = new HashMap<>();
        for (PersonOccurrence person : resolution.getPersonOccurrences()) {
            String personId = personIds.computeIfAbsent(person.getCanonicalName(),
                    name -> ensurePerson(name, person.getAliases()));
            writePersonOccurrence(personId, person);
        }
        for (CityOccurrence occurrence : resolution.getCityOccurrences()) {
            writeCityOccurrence(occurrence);
        }
    }
}
