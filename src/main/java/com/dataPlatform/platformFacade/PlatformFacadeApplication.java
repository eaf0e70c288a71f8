package com.dataPlatform.platformFacade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlatformFacadeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlatformFacadeApplication.class, args);
    }
}
