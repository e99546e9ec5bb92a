package com.example.musiccollection.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musicCollectionOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Music Collection API")
                        .description("Library, catalog and listening history queries over the synced collection store")
                        .version("v1")
                        .contact(new Contact().name("music-collection-sync")));
    }
}
