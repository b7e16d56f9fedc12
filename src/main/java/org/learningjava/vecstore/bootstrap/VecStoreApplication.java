package org.learningjava.vecstore.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.vecstore")
public class VecStoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(VecStoreApplication.class, args);
    }
}
