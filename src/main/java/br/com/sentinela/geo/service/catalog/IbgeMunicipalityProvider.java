package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.dto.ibge.IbgeMunicipioDTO;
import br.com.sentinela.geo.dto.ibge.IbgeMunicipioDTO.UfDTO;
import br.com.sentinela.geo.extraction.TextNormalizer;
import br.com.sentinela.geo.model.CatalogSource;
import br.com.sentinela.geo.model.CityRecord;
import br.com.sentinela.geo.model.Uf;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Provedor primário: API de localidades do IBGE.
 */
@Component
public class IbgeMunicipalityProvider extends HttpMunicipalityProvider<IbgeMunicipioDTO> {

    @Value("${app.catalog.sources.ibge.url:https://servicodados.ibge.gov.br/api/v1/localidades/municipios}")
    private String url;

    public IbgeMunicipalityProvider(RestTemplate restTemplate, ObjectMapper objectMapper) {
        super(restTemplate, objectMapper, IbgeMunicipioDTO.class);
    }

    @Override
    public CatalogSource getSource() {
        return CatalogSource.IBGE;
    }

    @Override
    protected String getUrl() {
        return url;
    }

    @Override
    protected CityRecord toRecord(IbgeMunicipioDTO dto) {
        UfDTO ufDto = null;
        String mesoregion = null;
        String microregion = null;
        if (dto.getMicrorregiao() != null) {
            microregion = dto.getMicrorregiao().getNome();
            if (dto.getMicrorregiao().getMesorregiao() != null) {
                mesoregion = dto.getMicrorregiao().getMesorregiao().getNome();
                ufDto = dto.getMicrorregiao().getMesorregiao().getUf();
            }
        }
        if (ufDto == null && dto.getRegiaoImediata() != null
                && dto.getRegiaoImediata().getRegiaoIntermediaria() != null) {
            ufDto = dto.getRegiaoImediata().getRegiaoIntermediaria().getUf();
        }

        String sigla = ufDto != null ? ufDto.getSigla() : null;
        Uf uf = Uf.fromSigla(sigla);
        String name = dto.getNome();
        boolean capital = uf != null && name != null
                && TextNormalizer.lookupKey(uf.getCapital()).equals(TextNormalizer.lookupKey(name));

        return CityRecord.builder()
                .ibgeId(dto.getId() != null ? String.valueOf(dto.getId()) : null)
                .name(name)
                .uf(sigla)
                .state(ufDto != null ? ufDto.getNome() : null)
                .region(ufDto != null && ufDto.getRegiao() != null ? ufDto.getRegiao().getNome() : null)
                .mesoregion(mesoregion)
                .microregion(microregion)
                .capital(capital)
                .build();
    }
}
