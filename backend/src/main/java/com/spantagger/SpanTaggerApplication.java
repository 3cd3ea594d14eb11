package com.spantagger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SpanTagger - span tag parsing, encoding and conversion service.
 */
@SpringBootApplication
public class SpanTaggerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SpanTaggerApplication.class, args);
	}

}
