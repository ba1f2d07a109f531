package io.github.riemr.sampling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SamplingAssignmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(SamplingAssignmentApplication.class, args);
    }
}
