package io.github.devsha256.odataclient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ODataClientApplication {

    public static void main(String[] args) {
        SpringApplication.run(ODataClientApplication.class, args);
    }
}
