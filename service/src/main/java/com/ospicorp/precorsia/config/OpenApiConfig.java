package com.ospicorp.precorsia.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Precorsia Correlation API")
            .version("v1")
            .description("Lagged correlation of two co-located remote-sensing raster series")
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
