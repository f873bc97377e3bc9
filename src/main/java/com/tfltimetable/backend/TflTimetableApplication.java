package com.tfltimetable.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TflTimetableApplication {

	public static void main(String[] args) {
		SpringApplication.run(TflTimetableApplication.class, args);
	}

}
