package de.bycsitsm.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    /**
     * Source of "now" for slot search and aggregation timestamps, in the server's local time zone.
     */
    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
