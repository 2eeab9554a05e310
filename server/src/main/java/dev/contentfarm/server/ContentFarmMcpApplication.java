package dev.contentfarm.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the content farm MCP Spring Boot application.
 */
@SpringBootApplication
public class ContentFarmMcpApplication {

	/**
	 * Bootstrap the Spring Boot application.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication.run(ContentFarmMcpApplication.class, args);
	}

}
