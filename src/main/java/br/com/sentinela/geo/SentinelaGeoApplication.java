package br.com.sentinela.geo;

import br.com.sentinela.geo.service.catalog.CatalogBuildException;
import br.com.sentinela.geo.service.catalog.CatalogBuildService;
import br.com.sentinela.geo.service.catalog.CatalogIntegrityException;
import br.com.sentinela.geo.service.catalog.CatalogStorage;
import br.com.sentinela.geo.service.catalog.GazetteerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;


@SpringBootApplication
@EnableScheduling
public class SentinelaGeoApplication implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(SentinelaGeoApplication.class);

	@Autowired
	private CatalogBuildService catalogBuildService;

	@Autowired
	private CatalogStorage catalogStorage;

	@Autowired
	private GazetteerService gazetteerService;

	@Value("${app.catalog.version:v1}")
	private String catalogVersion;

	@Value("${app.catalog.build-on-startup:false}")
	private boolean buildOnStartup;

	public static void main(String[] args) {
		SpringApplication.run(SentinelaGeoApplication.class, args);
	}

	@Override
	public void run(String... args) {
		logger.info(">>> Sentinela Geo iniciado. Verificando o catálogo de municípios {}...", catalogVersion);
		try {
			if (buildOnStartup && !catalogStorage.exists(catalogVersion)) {
				catalogBuildService.build(false);
			}
			gazetteerService.load();
		} catch (CatalogBuildException | CatalogIntegrityException e) {
			// A extração fica parada até um build ou reload pelo endpoint administrativo
			logger.error(">>> Gazetteer não carregado: {}", e.getMessage());
			return;
		}
		logger.info(">>> Tarefas de inicialização concluídas.");
	}
}
