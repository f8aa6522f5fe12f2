package com.slb.rewards_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication(scanBasePackages = "com.slb.rewards_backend")
@MapperScan("com.slb.rewards_backend.modules.*.mapper")
@ConfigurationPropertiesScan("com.slb.rewards_backend")
@EnableCaching
public class RewardsBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(RewardsBackendApplication.class, args);
	}

}
