package br.com.sentinela.geo.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuração de beans para a aplicação
 */
@Configuration
public class AppConfig {

    /**
     * RestTemplate dos provedores de municípios, com timeouts de conexão e leitura
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${app.catalog.http.connect-timeout-ms:10000}") long connectTimeoutMs,
                                     @Value("${app.catalog.http.read-timeout-ms:60000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
