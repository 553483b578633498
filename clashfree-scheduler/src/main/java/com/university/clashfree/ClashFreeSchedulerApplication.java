package com.university.clashfree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClashFreeSchedulerApplication {
	public static void main(String[] args) {
		SpringApplication.run(ClashFreeSchedulerApplication.class, args);
	}
}
