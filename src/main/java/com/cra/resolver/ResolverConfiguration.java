package com.cra.resolver;

import com.cra.atlas.AtlasRegistry;
import com.cra.config.CraProperties;
import com.cra.context.ContextRegistry;
import com.cra.policy.PolicyEvaluator;
import com.cra.trace.TraceProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ResolverConfiguration {

    @Bean
    public AtlasRegistry atlasRegistry() {
        return new AtlasRegistry();
    }

    @Bean
    public ContextRegistry contextRegistry() {
        return new ContextRegistry();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public Resolver resolver(AtlasRegistry atlasRegistry,
                             ContextRegistry contextRegistry,
                             PolicyEvaluator policyEvaluator,
                             TraceProcessor traceProcessor,
                             CraProperties properties,
                             Clock clock) {
        return new Resolver(atlasRegistry, contextRegistry, policyEvaluator, traceProcessor, properties, clock);
    }
}
