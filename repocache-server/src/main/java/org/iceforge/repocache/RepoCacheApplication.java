package org.iceforge.repocache;

import org.iceforge.repocache.config.RepoCacheProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({RepoCacheProperties.class})
public class RepoCacheApplication {

	public static void main(String[] args) {
		SpringApplication.run(RepoCacheApplication.class, args);
	}
}
