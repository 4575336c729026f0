package com.carelogs.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {
        "com.carelogs.pipeline",
        "com.carelogs.common"
})
public class CareLogsPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareLogsPipelineApplication.class, args);
    }

}
