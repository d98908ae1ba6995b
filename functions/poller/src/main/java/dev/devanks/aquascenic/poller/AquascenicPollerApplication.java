// functions/poller/src/main/java/dev/devanks/aquascenic/poller/AquascenicPollerApplication.java
package dev.devanks.aquascenic.poller;

import dev.devanks.aquascenic.poller.device.PoolDeviceController;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableFeignClients
public class AquascenicPollerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AquascenicPollerApplication.class, args);
    }

    /**
     * Starts the configured pool device once the context is up: first poll, then the
     * recurring timer. Polling keeps the JVM alive through the scheduler threads.
     */
    @Bean
    public ApplicationRunner startPoolDevice(PoolDeviceController poolDeviceController) {
        return args -> poolDeviceController.start();
    }
}
