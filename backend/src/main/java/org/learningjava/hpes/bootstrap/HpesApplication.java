package org.learningjava.hpes.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.hpes")
public class HpesApplication {
    public static void main(String[] args) {
        SpringApplication.run(HpesApplication.class, args);
    }
}
