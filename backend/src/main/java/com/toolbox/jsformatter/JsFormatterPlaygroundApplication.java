package com.toolbox.jsformatter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JsFormatterPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(JsFormatterPlaygroundApplication.class, args);
    }
}
