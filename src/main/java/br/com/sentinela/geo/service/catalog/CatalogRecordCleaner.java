package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CityRecord;
import br.com.sentinela.geo.model.Uf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Limpeza dos registros brutos de um provedor antes do checksum:
 * <ol>
 *     <li>descarta registros sem código IBGE ou sem nome</li>
 *     <li>remove duplicatas pelo código IBGE, mantendo a primeira ocorrência</li>
 *     <li>completa estado e região pela tabela de UFs</li>
 *     <li>gera nomes alternativos (sem apóstrofo, hífen como espaço)</li>
 *     <li>ordena pelo código IBGE numérico</li>
 * </ol>
 */
@Component
public class CatalogRecordCleaner {

    private static final Logger logger = LoggerFactory.getLogger(CatalogRecordCleaner.class);

    static final Comparator<CityRecord> BY_IBGE_ID = Comparator
            .comparing((CityRecord r) -> numericId(r.getIbgeId()))
            .thenComparing(CityRecord::getIbgeId);

    public List<CityRecord> clean(List<CityRecord> raw) {
        Map<String, CityRecord> unique = new LinkedHashMap<>();
        int discarded = 0;
        int duplicates = 0;

        for (CityRecord record : raw) {
            String ibgeId = trimToNull(record.getIbgeId());
            String name = trimToNull(record.getName());
            if (ibgeId == null || name == null) {
                discarded++;
                continue;
            }
            if (unique.containsKey(ibgeId)) {
                duplicates++;
                continue;
            }
            unique.put(ibgeId, complete(record, ibgeId, name));
        }

        List<CityRecord> cleaned = new ArrayList<>(unique.values());
        cleaned.sort(BY_IBGE_ID);
        logger.info("Limpeza do catálogo: {} registros válidos, {} descartados, {} duplicados",
                cleaned.size(), discarded, duplicates);
        return cleaned;
    }

    private CityRecord complete(CityRecord record, String ibgeId, String name) {
        String sigla = trimToNull(record.getUf());
        Uf uf = Uf.fromSigla(sigla);
        CityRecord.CityRecordBuilder builder = record.toBuilder()
                .ibgeId(ibgeId)
                .name(name)
                .uf(sigla != null ? sigla.toUpperCase(Locale.ROOT) : null)
                .altNames(alternateNames(name, record.getAltNames()));
        if (uf != null) {
            if (trimToNull(record.getState()) == null) {
                builder.state(uf.getNome());
            }
            if (trimToNull(record.getRegion()) == null) {
                builder.region(uf.getRegiao());
            }
        }
        return builder.build();
    }

    static SortedSet<String> alternateNames(String name, SortedSet<String> existing) {
        SortedSet<String> names = new TreeSet<>();
        for (String alt : existing) {
            String trimmed = trimToNull(alt);
            if (trimmed != null) {
                names.add(trimmed);
            }
        }
        names.add(collapse(name.replace('-', ' ')));
        names.add(collapse(name.replaceAll("['\u2019`]", "")));
        names.add(collapse(name.replaceAll("['\u2019`]", " ")));
        names.remove(name);
        return names;
    }

    private static String collapse(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static long numericId(String ibgeId) {
        try {
            return Long.parseLong(ibgeId);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
