package org.crynn.storage;

import org.crynn.storage.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(StorageProperties.class)
public class CrynnStorageApplication {

	public static void main(String[] args) {
		SpringApplication.run(CrynnStorageApplication.class, args);
	}
}
