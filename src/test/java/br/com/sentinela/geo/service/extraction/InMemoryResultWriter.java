package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.CityOccurrence;
import br.com.sentinela.geo.model.PersonOccurrence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writer em memória com a mesma chave de idempotência das tabelas.
 */
class InMemoryResultWriter implements ExtractionResultWriter {

    final Map<String, CityOccurrence> cityOccurrences = new LinkedHashMap<>();
    final Map<String, PersonOccurrence> personOccurrences = new LinkedHashMap<>();
    final Map<String, Set<String>> persons = new LinkedHashMap<>();

    private static String key(String url, int start, int end) {
        return url + "|" + start + "|" + end;
    }

    @Override
    public String ensurePerson(String canonicalName, Set<String> aliases) {
        persons.computeIfAbsent(canonicalName, k -> new TreeSet<>()).addAll(aliases);
        return canonicalName;
    }

    @Override
    public void writeCityOccurrence(CityOccurrence occurrence) {
        cityOccurrences.put(key(occurrence.getArticleUrl(), occurrence.getStart(), occurrence.getEnd()), occurrence);
    }

    @Override
    public void writePersonOccurrence(String personId, PersonOccurrence occurrence) {
        personOccurrences.put(key(occurrence.getArticleUrl(), occurrence.getStart(), occurrence.getEnd()), occurrence);
    }

    List<CityOccurrence> occurrencesOf(String url) {
        List<CityOccurrence> result = new ArrayList<>();
        for (CityOccurrence occurrence : cityOccurrences.values()) {
            if (occurrence.getArticleUrl().equals(url)) {
                result.add(occurrence);
            }
        }
        return result;
    }
}
