package com.example.resource;

import com.example.common.config.TimeConfig;
import com.example.common.token.SessionTokenConfig;
import com.example.common.web.RequestMdcWebConfig;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@Import({TimeConfig.class, RequestMdcWebConfig.class, SessionTokenConfig.class})
@RestController
public class ResourceApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResourceApplication.class, args);
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "healthy", "service", "resource-service");
  }
}
