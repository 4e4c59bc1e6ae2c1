package com.medledger.consentservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Enable scheduled cache sweeps
public class ConsentServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(ConsentServiceApplication.class, args);
	}

}
