package com.jasmin.webloghunter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
@EnableConfigurationProperties
@ConfigurationPropertiesScan
public class WeblogHunterApplication {

	public static void main(String[] args) {
		boolean batch = Arrays.stream(args).anyMatch(a -> a.startsWith("--input"));

		SpringApplication app = new SpringApplication(WeblogHunterApplication.class);
		if (batch) {
			// one-shot report run, no HTTP listener
			app.setWebApplicationType(WebApplicationType.NONE);
		}
		ConfigurableApplicationContext ctx = app.run(args);
		if (batch) {
			System.exit(SpringApplication.exit(ctx));
		}
	}

}
