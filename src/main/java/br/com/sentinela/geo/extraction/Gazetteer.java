package br.com.sentinela.geo.extraction;

import br.com.sentinela.geo.model.CityRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Índice em memória dos municípios do catálogo, por nome normalizado (sem acentos, minúsculo,
 * espaços colapsados). Nomes alternativos são indexados da mesma forma que o nome oficial.
 * Imutável depois de construído, pode ser compartilhado entre threads.
 */
public final class Gazetteer {

    // Capitais primeiro, depois código IBGE numérico crescente
    static final Comparator<CityRecord> CANDIDATE_ORDER = Comparator
            .comparing((CityRecord r) -> !r.isCapital())
            .thenComparing(r -> ibgeSortKey(r.getIbgeId()))
            .thenComparing(CityRecord::getIbgeId);

    private final Map<String, List<CityRecord>> byName;
    private final Map<String, CityRecord> byId;

    public Gazetteer(Collection<CityRecord> records) {
        Map<String, Map<String, CityRecord>> index = new HashMap<>();
        Map<String, CityRecord> ids = new LinkedHashMap<>();
        for (CityRecord record : records) {
            ids.putIfAbsent(record.getIbgeId(), record);
            indexName(index, record.getName(), record);
            for (String alt : record.getAltNames()) {
                indexName(index, alt, record);
            }
        }
        Map<String, List<CityRecord>> sorted = new HashMap<>();
        index.forEach((key, entries) -> {
            List<CityRecord> list = new ArrayList<>(entries.values());
            list.sort(CANDIDATE_ORDER);
            sorted.put(key, Collections.unmodifiableList(list));
        });
        this.byName = Collections.unmodifiableMap(sorted);
        this.byId = Collections.unmodifiableMap(ids);
    }

    private static void indexName(Map<String, Map<String, CityRecord>> index, String name, CityRecord record) {
        String key = TextNormalizer.lookupKey(name);
        if (key.isEmpty()) {
            return;
        }
        index.computeIfAbsent(key, k -> new LinkedHashMap<>()).putIfAbsent(record.getIbgeId(), record);
    }

    /**
     * Busca candidatos para um nome. Com {@code ufHint}, os candidatos daquela UF têm
     * precedência; se nenhum for da UF indicada, devolve o conjunto completo, já que a
     * própria dica pode estar errada.
     *
     * @return candidatos em ordem estável, vazio se o nome não existe no catálogo
     */
    public List<CityRecord> lookup(String name, String ufHint) {
        List<CityRecord> all = candidates(name);
        if (ufHint == null || ufHint.isBlank() || all.isEmpty()) {
            return all;
        }
        List<CityRecord> filtered = filterByUf(all, ufHint);
        return filtered.isEmpty() ? all : filtered;
    }

    public List<CityRecord> lookup(String name) {
        return lookup(name, null);
    }

    public List<CityRecord> candidates(String name) {
        if (name == null) {
            return List.of();
        }
        return byName.getOrDefault(TextNormalizer.lookupKey(name), List.of());
    }

    public boolean contains(String name) {
        return !candidates(name).isEmpty();
    }

    public Optional<CityRecord> findById(String ibgeId) {
        return Optional.ofNullable(byId.get(ibgeId));
    }

    public int size() {
        return byId.size();
    }

    static List<CityRecord> filterByUf(List<CityRecord> records, String uf) {
        List<CityRecord> filtered = new ArrayList<>();
        for (CityRecord record : records) {
            if (uf.equalsIgnoreCase(record.getUf())) {
                filtered.add(record);
            }
        }
        return filtered;
    }

    static long ibgeSortKey(String ibgeId) {
        try {
            return Long.parseLong(ibgeId.trim());
        } catch (NumberFormatException | NullPointerException e) {
            return Long.MAX_VALUE;
        }
    }
}
