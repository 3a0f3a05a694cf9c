package com.elssolution.livestxm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveStxmApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveStxmApplication.class, args);
    }

}
