package uk.gegc.adaptivetest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdaptiveTestApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveTestApplication.class, args);
    }
}
