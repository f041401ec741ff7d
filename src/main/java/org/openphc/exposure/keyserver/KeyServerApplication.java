package org.openphc.exposure.keyserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KeyServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyServerApplication.class, args);
    }
}
