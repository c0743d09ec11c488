package com.adkstream.app.config;

import com.adkstream.app.runtime.DemoAgentRuntime;
import com.adkstream.common.config.ConfigService;
import com.adkstream.gateway.approval.FrontendToolDelegate;
import com.adkstream.gateway.runtime.AgentRuntime;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application-level beans: the agent runtime and the threads it runs on.
 */
@Configuration
public class AppBeanConfig {

    /** Turns block while waiting for approvals, so they get their own threads. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService turnExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "adkstream-turn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public AgentRuntime agentRuntime(ConfigService configService, FrontendToolDelegate frontendToolDelegate,
            ExecutorService turnExecutor) {
        return new DemoAgentRuntime(configService, frontendToolDelegate, turnExecutor);
    }
}
