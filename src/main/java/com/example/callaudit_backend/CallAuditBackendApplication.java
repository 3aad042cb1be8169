package com.example.callaudit_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CallAuditBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(CallAuditBackendApplication.class, args);
	}

}
