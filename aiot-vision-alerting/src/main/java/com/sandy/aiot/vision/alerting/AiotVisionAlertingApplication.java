package com.sandy.aiot.vision.alerting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotVisionAlertingApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiotVisionAlertingApplication.class, args);
    }

}
