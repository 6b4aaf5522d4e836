package com.example.statements;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the statement parser.
 * This class only wires the application context and hands over control to Spring.
 */
@SpringBootApplication
public class StatementParserApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(StatementParserApplication.class, args);
	}

}
