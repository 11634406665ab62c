package com.traini8.traini8.config;

import javax.sql.DataSource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jasypt.encryption.StringEncryptor;
import org.jasypt.properties.PropertyValueEncryptionUtils;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 레코드 저장소 커넥션 풀. 기동 시 한 번 만들어지고 컨텍스트 종료 시 close 된다.
 * url / username / password 는 평문 또는 ENC(...) 둘 다 받는다.
 */
@Configuration
@EnableConfigurationProperties(DataSourceProperties.class)
public class DataSourceConfig {

  private final DataSourceProperties props;
  private final StringEncryptor encryptor;

  public DataSourceConfig(DataSourceProperties props, StringEncryptor encryptor) {
    this.props = props;
    this.encryptor = encryptor;
  }

  @Bean(destroyMethod = "close")
  public DataSource dataSource() {
    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName("traini8-store");
    cfg.setJdbcUrl(credential(props.determineUrl()));
    cfg.setUsername(credential(props.determineUsername()));
    cfg.setPassword(credential(props.determinePassword()));
    cfg.setDriverClassName(props.determineDriverClassName());
    return new HikariDataSource(cfg);
  }

  // ENC(...) 판별/해제는 jasypt 규칙을 그대로 따른다
  String credential(String value) {
    if (value == null || !PropertyValueEncryptionUtils.isEncryptedValue(value)) {
      return value;
    }
    return PropertyValueEncryptionUtils.decrypt(value, encryptor);
  }
}
