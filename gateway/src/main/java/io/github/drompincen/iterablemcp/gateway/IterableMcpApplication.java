package io.github.drompincen.iterablemcp.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.iterablemcp")
public class IterableMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(IterableMcpApplication.class, args);
    }
}
