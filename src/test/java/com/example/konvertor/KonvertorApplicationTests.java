package com.example.konvertor;

import com.example.konvertor.interfaces.cli.ConversionCommandLineRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke test verifying the Spring context boots in HTTP mode.
 */
@SpringBootTest
class KonvertorApplicationTests {

	@Autowired
	private ApplicationContext context;

	/**
	 * Ensures the context loads and the command-line runner stays disabled by default.
	 */
	@Test
	void contextLoads() {
		assertThat(context.getBeanNamesForType(ConversionCommandLineRunner.class)).isEmpty();
	}

}
