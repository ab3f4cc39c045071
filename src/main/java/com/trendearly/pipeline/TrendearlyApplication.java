package com.trendearly.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableJpaRepositories
@ConfigurationPropertiesScan
public class TrendearlyApplication {

	public static void main(String[] args) {
		SpringApplication.run(TrendearlyApplication.class, args);
	}
}
