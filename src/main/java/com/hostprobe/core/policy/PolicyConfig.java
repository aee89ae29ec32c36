package com.hostprobe.core.policy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PolicyConfig {

    @Bean
    public PolicyStore policyStore(PolicyProperties properties) {
        return PolicyStore.from(properties);
    }
}
