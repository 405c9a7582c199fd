package com.claimflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class ClaimsConfigConfiguration {

    @Bean
    public ClaimsConfigLoader claimsConfigLoader(ObjectMapper objectMapper) {
        return new ClaimsConfigLoader(objectMapper);
    }

    /**
     * The single configuration value shared by the policy store, the classifier
     * and both engines. A broken document fails context startup.
     */
    @Bean
    public ClaimsConfig claimsConfig(ClaimsConfigLoader loader,
                                     ResourceLoader resourceLoader,
                                     @Value("${claimflow.config-location:classpath:claims-config.json}") String location) {
        return loader.load(resourceLoader.getResource(location));
    }
}
