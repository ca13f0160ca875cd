package ca.carms.residency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the residency data platform.
 *
 * Loads the raw discipline, program master and program description extracts
 * into PostgreSQL through a Spring Batch job, and serves read and search
 * access over the normalized tables.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ResidencyDataPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResidencyDataPlatformApplication.class, args);
    }
}
