package com.Tkmind.recall_bridge;

import com.Tkmind.recall_bridge.config.RecallConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RecallConfig.class)
public class RecallBridgeApplication {
	public static void main(String[] args) {
		SpringApplication.run(RecallBridgeApplication.class, args);
	}
}
