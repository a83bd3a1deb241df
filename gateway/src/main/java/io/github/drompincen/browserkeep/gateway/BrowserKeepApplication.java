package io.github.drompincen.browserkeep.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.browserkeep")
@EnableMongoRepositories(basePackages = "io.github.drompincen.browserkeep.persistence.repository")
@EnableScheduling
public class BrowserKeepApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrowserKeepApplication.class, args);
    }
}
