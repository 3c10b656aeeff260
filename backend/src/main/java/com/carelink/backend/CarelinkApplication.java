package com.carelink.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CarelinkApplication {

	public static void main(String[] args) {
		// Lockout windows and document expiry compare against UTC timestamps
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(CarelinkApplication.class, args);
	}

}
