package com.elssolution.tuyaexporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TuyaExporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(TuyaExporterApplication.class, args);
    }

}
