package com.text_classifier_app.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI textClassifierOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Text Classifier Training API")
                        .version("1.0.0")
                        .description("Submit labeled text examples for asynchronous training, follow training jobs and request predictions from trained models.")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local server")
                ));
    }

    @Bean
    public GroupedOpenApi trainingApi() {
        return GroupedOpenApi.builder()
                .group("Training APIs")
                .pathsToMatch("/api/**")
                .build();
    }
}
