package com.zeronote.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ZeroNoteServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZeroNoteServerApplication.class, args);
    }
}
