package com.photonamer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoNamerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoNamerApplication.class, args);
    }
}
