package org.econdata.fredproxy.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.ExternalDocumentation;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "FRED Proxy Service",
            version = "0",
            description = "Caching proxy for FRED economic data series and observations",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {@Server(url = "http://localhost:9001", description = "Local environment")},
    externalDocs =
        @ExternalDocumentation(
            description = "FRED API documentation",
            url = "https://fred.stlouisfed.org/docs/api/fred/"))
public class OpenApiConfig {}
