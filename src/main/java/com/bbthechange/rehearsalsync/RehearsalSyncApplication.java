package com.bbthechange.rehearsalsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RehearsalSyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(RehearsalSyncApplication.class, args);
	}

}
