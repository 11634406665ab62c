package com.traini8.traini8.controller;

import com.traini8.traini8.config.Traini8Properties;
import java.util.Collections;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HomeController {

  private final Traini8Properties props;

  @GetMapping("/")
  public ResponseEntity<Map<String, String>> home() {
    return ResponseEntity.ok(
        Collections.singletonMap("message", props.getServiceName() + " API is running"));
  }
}
