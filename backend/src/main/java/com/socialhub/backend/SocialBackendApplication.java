package com.socialhub.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SocialBackendApplication {

	public static void main(String[] args) {
		// Timeouts and token expiries are compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(SocialBackendApplication.class, args);
	}

}
