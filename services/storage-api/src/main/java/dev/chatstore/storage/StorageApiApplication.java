package dev.chatstore.storage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StorageApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorageApiApplication.class, args);
    }
}
