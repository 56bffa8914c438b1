package com.streamfirst.canvas.sync.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CanvasSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CanvasSyncApplication.class, args);
    }
}
