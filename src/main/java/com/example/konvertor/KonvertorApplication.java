package com.example.konvertor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.SimpleCommandLinePropertySource;
import org.springframework.core.env.StandardEnvironment;

/**
 * Application entry point.
 * Starts the HTTP API, or runs a single command-line conversion and exits when {@code konvertor.cli.enabled=true}.
 */
@SpringBootApplication
public class KonvertorApplication {

	static final String CLI_ENABLED_PROPERTY = "konvertor.cli.enabled";

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		ConfigurableApplicationContext context = createApplication(args).run(args);
		if (isCliRun(args)) {
			System.exit(SpringApplication.exit(context));
		}
	}

	/**
	 * Builds the application. Command-line runs get no embedded web server.
	 *
	 * @param args command line arguments
	 * @return configured application, not yet started
	 */
	static SpringApplication createApplication(String[] args) {
		return new SpringApplicationBuilder(KonvertorApplication.class)
				.web(isCliRun(args) ? WebApplicationType.NONE : WebApplicationType.SERVLET)
				.build();
	}

	/**
	 * @param args command line arguments
	 * @return whether the CLI switch is set on the command line, as a system property or in the environment
	 */
	static boolean isCliRun(String[] args) {
		StandardEnvironment environment = new StandardEnvironment();
		environment.getPropertySources().addFirst(new SimpleCommandLinePropertySource(args));
		return environment.getProperty(CLI_ENABLED_PROPERTY, Boolean.class, false);
	}

}
