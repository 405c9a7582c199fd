package com.claimflow.routing;

import com.claimflow.config.ClaimsConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RoutingConfiguration {

    @Bean
    public RoutingEngine routingEngine() {
        return RoutingEngine.standard();
    }

    @Bean
    public RoutingThresholds routingThresholds(ClaimsConfig config) {
        return RoutingThresholds.from(config);
    }
}
