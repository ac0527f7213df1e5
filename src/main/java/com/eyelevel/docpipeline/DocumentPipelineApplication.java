package com.eyelevel.docpipeline;

import com.eyelevel.docpipeline.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the document pipeline service.
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.processing" properties to
 *     {@link PipelineProperties}.</li>
 *     <li>{@link EnableScheduling}: the nightly job cleanup.</li>
 *     <li>{@link EnableRetry}: retries around the Ghostscript compressor.</li>
 * </ul>
 */
@Slf4j
@EnableAsync
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.docpipeline.repository")
@EnableConfigurationProperties(value = PipelineProperties.class)
@EnableRetry
public class DocumentPipelineApplication {

    public static void main(final String[] args) {
        log.info("Starting DocumentPipelineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentPipelineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentPipeline"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
