package com.dronesim.queue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SimulationQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimulationQueueApplication.class, args);
    }
}
