package com.solusoft.medclaims;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MedClaimsApplication {

	public static void main(String[] args) {
		SpringApplication.run(MedClaimsApplication.class, args);
	}

}
