package com.traini8.traini8;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.web.servlet.support.SpringBootServletInitializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import com.traini8.traini8.repository.TrainingCenterRepository;


@SpringBootApplication(scanBasePackages = "com.traini8")
@ConfigurationPropertiesScan
@EnableAspectJAutoProxy(proxyTargetClass = true)
public class Traini8Application extends SpringBootServletInitializer {
	private static final Logger log = LoggerFactory.getLogger(Traini8Application.class);

	public static void main(String[] args) {
		SpringApplication.run(Traini8Application.class, args);
	}

	@Override
	protected SpringApplicationBuilder configure(SpringApplicationBuilder builder) {
		return builder.sources(Traini8Application.class);
	}

	/***
	 * 구동 시 저장소 연결 확인 겸 등록된 센터 수를 남긴다.
	 * 조회 실패는 기동을 막지 않는다.
	 */
	@Bean
	CommandLineRunner reportStore(TrainingCenterRepository repository) {
		return args -> {
			try {
				log.info("Record store ready, {} training center(s) registered", repository.count());
			} catch (Exception ex) {
				log.error("Record store check failed at startup, continuing:", ex);
			}
		};
	}
}
