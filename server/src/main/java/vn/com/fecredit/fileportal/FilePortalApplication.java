package vn.com.fecredit.fileportal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EntityScan("vn.com.fecredit.fileportal.model")
@EnableJpaRepositories("vn.com.fecredit.fileportal.model")
@ConfigurationPropertiesScan("vn.com.fecredit.fileportal.config")
@EnableScheduling
public class FilePortalApplication {
    /**
     * Entry point; delegates to {@link SpringApplication}.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(FilePortalApplication.class, args);
    }
}
