package io.newsdigest.ingestion;

import io.newsdigest.ingestion.config.DigestConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DigestConfig.class)
@ConfigurationPropertiesScan
public class DigestIngestionApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DigestIngestionApplication.class, args)));
    }
}
