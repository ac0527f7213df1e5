package com.eyelevel.docpipeline.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * API documentation for the job and queue administration endpoints. Not published in production.
 */
@Configuration
@Profile("!prod")
public class OpenApiConfig {

    @Bean
    public OpenAPI pipelineOpenApi(ObjectProvider<BuildProperties> buildProperties) {
        BuildProperties build = buildProperties.getIfAvailable();
        String version = build != null ? build.getVersion() : "dev";

        return new OpenAPI()
                .info(new Info()
                              .title("Document Pipeline API")
                              .version(version)
                              .description("""
                                      Submits background processing jobs for stored documents and administers the \
                                      queues that run them. Each job type has its own queue: OCR (Textract), \
                                      thumbnails, PDF operations, embeddings and AI classification.

                                      Drain and cleanup permanently remove queue entries.
                                      """))
                .addTagsItem(new Tag().name("Processing").description("Jobs, queues and maintenance"));
    }
}
