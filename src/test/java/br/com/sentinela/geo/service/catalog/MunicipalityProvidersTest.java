package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CityRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MunicipalityProvidersTest {

    private static final String IBGE_URL = "http://ibge.test/municipios";
    private static final String BRASILAPI_URL = "http://brasilapi.test/municipios";

    private MockRestServiceServer server;
    private IbgeMunicipalityProvider ibge;
    private BrasilApiMunicipalityProvider brasilApi;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ObjectMapper objectMapper = new ObjectMapper();
        ibge = new IbgeMunicipalityProvider(restTemplate, objectMapper);
        ReflectionTestUtils.setField(ibge, "url", IBGE_URL);
        brasilApi = new BrasilApiMunicipalityProvider(restTemplate, objectMapper);
        ReflectionTestUtils.setField(brasilApi, "url", BRASILAPI_URL);
    }

    @Nested
    @DisplayName("IBGE")
    class Ibge {

        @Test
        void mapsNestedUfAndMarksCapital() {
            server.expect(requestTo(IBGE_URL)).andRespond(withSuccess("""
                    [{"id": 2408102, "nome": "Natal",
                      "microrregiao": {"id": 24018, "nome": "Natal",
                        "mesorregiao": {"id": 2404, "nome": "Leste Potiguar",
                          "UF": {"id": 24, "sigla": "RN", "nome": "Rio Grande do Norte",
                                 "regiao": {"id": 2, "sigla": "NE", "nome": "Nordeste"}}}}},
                     {"id": 3509502, "nome": "Campinas",
                      "microrregiao": null,
                      "regiao-imediata": {"id": 350007, "nome": "Campinas",
                        "regiao-intermediaria": {"id": 3502, "nome": "Campinas",
                          "UF": {"id": 35, "sigla": "SP", "nome": "São Paulo",
                                 "regiao": {"id": 3, "sigla": "SE", "nome": "Sudeste"}}}}}]
                    """, MediaType.APPLICATION_JSON));

            List<CityRecord> records = ibge.fetchMunicipalities();

            assertThat(records).hasSize(2);
            CityRecord natal = records.get(0);
            assertThat(natal.getIbgeId()).isEqualTo("2408102");
            assertThat(natal.getUf()).isEqualTo("RN");
            assertThat(natal.getState()).isEqualTo("Rio Grande do Norte");
            assertThat(natal.getRegion()).isEqualTo("Nordeste");
            assertThat(natal.getMesoregion()).isEqualTo("Leste Potiguar");
            assertThat(natal.isCapital()).isTrue();
            CityRecord campinas = records.get(1);
            assertThat(campinas.getUf()).isEqualTo("SP");
            assertThat(campinas.isCapital()).isFalse();
            server.verify();
        }

        @Test
        void httpErrorBecomesProviderException() {
            server.expect(requestTo(IBGE_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertThatThrownBy(() -> ibge.fetchMunicipalities()).isInstanceOf(ProviderException.class);
        }

        @Test
        void nonListPayloadIsRejected() {
            server.expect(requestTo(IBGE_URL)).andRespond(withSuccess("{\"erro\": true}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> ibge.fetchMunicipalities())
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("lista de municípios");
        }

        @Test
        void emptyListIsRejected() {
            server.expect(requestTo(IBGE_URL)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> ibge.fetchMunicipalities()).isInstanceOf(ProviderException.class);
        }
    }

    @Nested
    @DisplayName("BrasilAPI")
    class BrasilApi {

        @Test
        void mapsOptionalFields() {
            server.expect(requestTo(BRASILAPI_URL)).andRespond(withSuccess("""
                    [{"nome": "Campinas", "codigo_ibge": "3509502", "estado": "SP",
                      "latitude": -22.9053, "longitude": "-47.0659", "capital": false,
                      "ddd": "19", "siafi_id": "6291", "fuso_horario": "America/Sao_Paulo"},
                     {"nome": "Natal", "codigo": 2408102, "uf": "RN", "latitude": "", "capital": true}]
                    """, MediaType.APPLICATION_JSON));

            List<CityRecord> records = brasilApi.fetchMunicipalities();

            CityRecord campinas = records.get(0);
            assertThat(campinas.getIbgeId()).isEqualTo("3509502");
            assertThat(campinas.getUf()).isEqualTo("SP");
            assertThat(campinas.getLatitude()).isEqualTo(-22.9053);
            assertThat(campinas.getLongitude()).isEqualTo(-47.0659);
            assertThat(campinas.getDdd()).isEqualTo("19");
            assertThat(campinas.getSiafiId()).isEqualTo("6291");
            assertThat(campinas.getTimezone()).isEqualTo("America/Sao_Paulo");
            CityRecord natal = records.get(1);
            assertThat(natal.getIbgeId()).isEqualTo("2408102");
            assertThat(natal.getUf()).isEqualTo("RN");
            assertThat(natal.getLatitude()).isNull();
            assertThat(natal.isCapital()).isTrue();
        }
    }
}
