package com.cra;

import com.cra.config.CraProperties;
import com.cra.resolver.Resolver;
import com.cra.trace.TraceProcessor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CraApplicationTests {

    @Autowired CraProperties properties;
    @Autowired Resolver resolver;
    @Autowired TraceProcessor traceProcessor;

    @Test
    void contextLoads_withDefaultConfiguration() {
        assertNotNull(resolver);
        assertEquals(CraProperties.ZERO_GENESIS, properties.trace().genesisSeed());
        assertEquals(4096, properties.trace().queueCapacity());
        assertEquals(300, properties.resolution().defaultTtlSeconds());
        assertEquals(CraProperties.defaults().policy(), properties.policy());
        assertTrue(traceProcessor.isRunning());
    }
}
