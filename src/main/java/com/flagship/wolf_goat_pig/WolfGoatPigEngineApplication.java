package com.flagship.wolf_goat_pig;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WolfGoatPigEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WolfGoatPigEngineApplication.class, args);
    }
}
