package com.example.compliance;

import com.example.compliance.config.ComplianceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceAnalyzerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ComplianceAnalyzerApplication.class, args);
	}

}
