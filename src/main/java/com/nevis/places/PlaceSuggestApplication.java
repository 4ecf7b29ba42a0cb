package com.nevis.places;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlaceSuggestApplication {

	public static void main(String[] args) {
		SpringApplication.run(PlaceSuggestApplication.class, args);
	}
}
