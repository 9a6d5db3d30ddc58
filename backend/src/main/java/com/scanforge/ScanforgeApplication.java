package com.scanforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Scanforge - rewrites Python stock-scanner scripts into a standard staged scanner architecture.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScanforgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScanforgeApplication.class, args);
	}

}
