package com.cra.policy;

import com.cra.config.CraProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PolicyConfiguration {

    @Bean
    public PolicyEvaluator policyEvaluator(CraProperties properties) {
        return PolicyEvaluator.standard(properties.policy());
    }
}
