package com.example.coa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the COA extraction service.
 * Wires the application context and exposes the endpoints under {@code /api/coa}.
 */
@SpringBootApplication
public class CoaApplication {

	public static void main(String[] args) {
		SpringApplication.run(CoaApplication.class, args);
	}

}
