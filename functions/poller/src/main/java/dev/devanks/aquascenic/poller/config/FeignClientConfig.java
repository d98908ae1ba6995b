// functions/poller/src/main/java/dev/devanks/aquascenic/poller/config/FeignClientConfig.java
package dev.devanks.aquascenic.poller.config;

import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Shared by the identity and document store clients. Authorization is passed per call,
 * since each pool client owns its own session.
 */
@Slf4j
public class FeignClientConfig {

    static final String USER_AGENT_VALUE = "Aquascenic-Pool-Poller-Java-Feign/1.0";

    @Bean
    public RequestInterceptor userAgentInterceptor() {
        return template -> {
            log.trace("Adding User-Agent header to {} {}", template.method(), template.path());
            template.header(USER_AGENT, USER_AGENT_VALUE);
        };
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
