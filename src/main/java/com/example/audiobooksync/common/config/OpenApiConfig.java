package com.example.audiobooksync.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI audiobookSyncOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Audiobook Sync API")
                        .description("Imports audiobooks from a media-player library export, keeps play statistics "
                                + "in sync and writes moved file locations back into the export")
                        .version("v1")
                        .license(new License().name("Internal use")));
    }

    @Bean
    public GroupedOpenApi importJobsApi() {
        return GroupedOpenApi.builder()
                .group("import-jobs")
                .pathsToMatch("/api/v1/import/**")
                .build();
    }

    @Bean
    public GroupedOpenApi writeBackApi() {
        return GroupedOpenApi.builder()
                .group("write-back")
                .pathsToMatch("/api/v1/library/write-back/**")
                .build();
    }
}
