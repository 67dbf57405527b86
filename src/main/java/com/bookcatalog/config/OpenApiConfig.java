package com.bookcatalog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI bookCatalogOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Book Catalog API")
                .description("JSON access to the book catalog: paginated, filterable listing "
                    + "and create/update/delete of book records.")
                .version("1.0.0"));
    }

    @Bean
    public GroupedOpenApi bookCatalogApi() {
        return GroupedOpenApi.builder()
            .group("books")
            .pathsToMatch("/api/v1/**")
            .build();
    }
}
