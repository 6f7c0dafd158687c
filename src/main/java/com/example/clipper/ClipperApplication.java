package com.example.clipper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClipperApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClipperApplication.class, args);
	}

}
