package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CityRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Base dos provedores HTTP: baixa a lista JSON, converte para os DTOs do provedor e
 * depois para {@link CityRecord}. Toda falha vira {@link ProviderException}.
 */
public abstract class HttpMunicipalityProvider<T> implements MunicipalityProvider {

    private static final Logger logger = LoggerFactory.getLogger(HttpMunicipalityProvider.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Class<T> dtoType;

    protected HttpMunicipalityProvider(RestTemplate restTemplate, ObjectMapper objectMapper, Class<T> dtoType) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.dtoType = dtoType;
    }

    protected abstract String getUrl();

    protected abstract CityRecord toRecord(T dto);

    @Override
    public List<CityRecord> fetchMunicipalities() {
        String url = getUrl();
        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new ProviderException(String.format("%s respondeu HTTP %d",
                        getSource().getCodigo(), response.getStatusCode().value()));
            }
            body = response.getBody();
        } catch (RestClientException e) {
            throw new ProviderException("Falha ao acessar " + getSource().getCodigo() + ": " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new ProviderException("Resposta vazia de " + getSource().getCodigo());
        }

        List<T> payload;
        try {
            JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, dtoType);
            payload = objectMapper.readValue(body, listType);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Resposta inválida de " + getSource().getCodigo()
                    + ": era esperada uma lista de municípios", e);
        }
        if (payload == null || payload.isEmpty()) {
            throw new ProviderException(getSource().getCodigo() + " não retornou municípios");
        }

        List<CityRecord> records = new ArrayList<>(payload.size());
        for (T dto : payload) {
            if (dto != null) {
                records.add(toRecord(dto));
            }
        }
        logger.info("Provedor {} retornou {} municípios de {}", getSource().getCodigo(), records.size(), url);
        return records;
    }
}
