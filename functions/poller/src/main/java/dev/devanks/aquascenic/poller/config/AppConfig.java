// functions/poller/src/main/java/dev/devanks/aquascenic/poller/config/AppConfig.java
package dev.devanks.aquascenic.poller.config;

import dev.devanks.aquascenic.poller.device.DeviceHost;
import dev.devanks.aquascenic.poller.device.PoolDeviceController;
import dev.devanks.aquascenic.poller.service.PoolClientFactory;
import dev.devanks.aquascenic.poller.session.Credentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2); // recurring poll + reconciliation polls
        scheduler.setThreadNamePrefix("pool-poller-");
        return scheduler;
    }

    @Bean(destroyMethod = "stop")
    public PoolDeviceController poolDeviceController(DeviceHost deviceHost, PoolClientFactory poolClientFactory,
                                                     PoolProperties properties) {
        PoolProperties.AccountProperties account = properties.getAccount();
        PoolProperties.PoolSettings pool = properties.getPool();
        Credentials credentials = account.isComplete()
                ? new Credentials(account.getEmail(), account.getPassword())
                : null;
        log.info("Initializing pool device controller for pool '{}'", pool.getId());
        return new PoolDeviceController(
                deviceHost,
                poolClientFactory,
                pool.getId() == null ? "" : pool.getId().trim(),
                credentials,
                Duration.ofMinutes(pool.getPollIntervalMinutes()),
                pool.getReconcileDelay());
    }
}
