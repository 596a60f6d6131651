package com.railmadad.triage.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  private static final String[] DEFAULT_METHODS = new String[] {"GET", "POST", "OPTIONS"};

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    var mapping = registry.addMapping("/api/**");

    if (allowedOrigins == null || allowedOrigins.length == 0) {
      mapping.allowedOriginPatterns("*");
    } else {
      mapping.allowedOriginPatterns(allowedOrigins);
    }

    mapping.allowedMethods(DEFAULT_METHODS).allowedHeaders("*").allowCredentials(true);
  }
}
