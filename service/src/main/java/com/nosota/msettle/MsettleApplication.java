package com.nosota.msettle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MsettleApplication {
    public static void main(String[] args) {
        SpringApplication.run(MsettleApplication.class, args);
    }
}
