package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.dto.brasilapi.BrasilApiMunicipioDTO;
import br.com.sentinela.geo.model.CatalogSource;
import br.com.sentinela.geo.model.CityRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Provedor secundário: BrasilAPI. Traz coordenadas, DDD, SIAFI e fuso, mas não traz
 * nome do estado; o limpador completa a partir da tabela de UFs.
 */
@Component
public class BrasilApiMunicipalityProvider extends HttpMunicipalityProvider<BrasilApiMunicipioDTO> {

    @Value("${app.catalog.sources.brasilapi.url:https://brasilapi.com.br/api/ibge/municipios/v1}")
    private String url;

    public BrasilApiMunicipalityProvider(RestTemplate restTemplate, ObjectMapper objectMapper) {
        super(restTemplate, objectMapper, BrasilApiMunicipioDTO.class);
    }

    @Override
    public CatalogSource getSource() {
        return CatalogSource.BRASILAPI;
    }

    @Override
    protected String getUrl() {
        return url;
    }

    @Override
    protected CityRecord toRecord(BrasilApiMunicipioDTO dto) {
        String ibgeId = firstNonBlank(dto.getCodigoIbge(), dto.getCodigo());
        return CityRecord.builder()
                .ibgeId(ibgeId)
                .name(dto.getNome())
                .uf(firstNonBlank(dto.getEstado(), dto.getUf()))
                .region(dto.getRegiao())
                .latitude(toDouble(dto.getLatitude()))
                .longitude(toDouble(dto.getLongitude()))
                .capital(Boolean.TRUE.equals(dto.getCapital()))
                .siafiId(dto.getSiafiId())
                .ddd(dto.getDdd())
                .timezone(firstNonBlank(dto.getFusoHorario(), dto.getTimezone()))
                .build();
    }

    static Double toDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
