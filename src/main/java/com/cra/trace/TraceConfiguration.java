package com.cra.trace;

import com.cra.config.CraProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TraceConfiguration {

    @Bean
    public TraceLog traceLog(CraProperties properties) {
        return new InMemoryTraceLog(properties.trace().genesisSeed());
    }

    @Bean(destroyMethod = "close")
    public TraceProcessor traceProcessor(TraceLog traceLog, CraProperties properties) {
        return new TraceProcessor(traceLog, properties.trace());
    }
}
