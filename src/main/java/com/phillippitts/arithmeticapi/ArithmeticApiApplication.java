package com.phillippitts.arithmeticapi;

import com.phillippitts.arithmeticapi.config.properties.ArithmeticProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ArithmeticProperties.class)
public class ArithmeticApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArithmeticApiApplication.class, args);
    }

}
