package com.example.modelvault_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelVaultBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ModelVaultBackendApplication.class, args);
	}

}
