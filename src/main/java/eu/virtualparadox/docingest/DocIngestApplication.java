package eu.virtualparadox.docingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocIngestApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocIngestApplication.class, args);
    }
}
