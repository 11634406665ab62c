package com.traini8.traini8.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.properties 의 traini8.* 설정
 */
@ConfigurationProperties(prefix = "traini8")
@Data
public class Traini8Properties {

  /** 헬스 체크 메시지에 들어가는 서비스명 */
  private String serviceName = "Traini8 Backend";

  private Cors cors = new Cors();

  @Data
  public static class Cors {
    // 비어 있으면 모든 origin 패턴 허용
    private List<String> allowedOrigins = new ArrayList<>();
  }
}
