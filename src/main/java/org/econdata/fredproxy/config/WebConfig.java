package org.econdata.fredproxy.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Allows browser clients on any configured origin to call the read-only endpoints. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final FredProxyProperties properties;

  public WebConfig(FredProxyProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/v0/**")
        .allowedOrigins(properties.getCors().getAllowedOrigins().toArray(String[]::new))
        .allowedMethods("GET");
  }
}
