package com.traini8.traini8.config;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

  private final Traini8Properties props;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> origins = props.getCors().getAllowedOrigins();
    var mapping = registry.addMapping("/**")
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .maxAge(3600);

    if (origins == null || origins.isEmpty()) {
      mapping.allowedOriginPatterns("*");
    } else {
      mapping.allowedOrigins(origins.toArray(String[]::new));
    }
  }
}
