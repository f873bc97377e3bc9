package com.tfltimetable.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class ApiMetadataConfig implements WebMvcConfigurer {

        @Override
        public void addViewControllers(ViewControllerRegistry registry) {
                registry.addRedirectViewController("/docs", "/swagger-ui.html");
                registry.addRedirectViewController("/docs/", "/swagger-ui.html");
        }

        @Bean
        public OpenAPI timetableOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("TfL Timetable API documentation")
                                                .description(
                                                                "Resolves stations to (line, platform) pairs and renders TfL line timetables as fixed-width text grids.")
                                                .version("v1.0.0")
                                                .license(new License().name("Apache 2.0").url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development")));
        }
}
