package org.gc.relaymonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication(scanBasePackages = "org.gc")
public class RelayMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayMonitorApplication.class, args);
    }

}
