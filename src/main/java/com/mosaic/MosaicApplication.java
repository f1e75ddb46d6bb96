package com.mosaic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MosaicApplication {

    public static void main(String[] args) {
        SpringApplication.run(MosaicApplication.class, args);
    }
}
