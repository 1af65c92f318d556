package com.williamcallahan.codelab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CodelabParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodelabParserApplication.class, args);
    }

}
