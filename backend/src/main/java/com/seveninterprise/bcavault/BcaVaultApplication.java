package com.seveninterprise.bcavault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BcaVaultApplication {

	public static void main(String[] args) {
		SpringApplication.run(BcaVaultApplication.class, args);
	}

}
