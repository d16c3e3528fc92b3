package com.livepipe.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LivePipeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LivePipeApplication.class, args);
    }
}
