package com.elssolution.livestxm.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.zeromq.ZContext;

@Slf4j
@Configuration
public class TransportConfig {

    @Value("${stxm.transport.ioThreads:1}")
    private int ioThreads;

    /**
     * One context for every stage in this JVM. Spring destroys the stages first
     * (they depend on this bean), so by the time close() runs no loop owns a socket.
     */
    @Bean(destroyMethod = "close")
    public ZContext zmqContext() {
        ZContext ctx = new ZContext(Math.max(1, ioThreads));
        ctx.setLinger(0);
        log.info("zmq_context_ready ioThreads={}", Math.max(1, ioThreads));
        return ctx;
    }
}
