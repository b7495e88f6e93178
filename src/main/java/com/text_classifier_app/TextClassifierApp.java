package com.text_classifier_app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class TextClassifierApp {

	static {
		// Disable Weka's class discovery cache to prevent ZIP file scanning issues with Spring Boot fat JARs
		System.setProperty("weka.core.ClassDiscovery.enableCache", "false");
	}

	public static void main(String[] args) {
		SpringApplication.run(TextClassifierApp.class, args);
	}
}
