package com.tony.sportsFeatures;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SportsFeaturesApplication {

	public static void main(String[] args) {
		SpringApplication.run(SportsFeaturesApplication.class, args);
	}

}
