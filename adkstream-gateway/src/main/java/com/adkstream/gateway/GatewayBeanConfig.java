package com.adkstream.gateway;

import com.adkstream.common.config.ConfigService;
import com.adkstream.common.config.StreamConfig;
import com.adkstream.gateway.approval.ApprovalRegistry;
import com.adkstream.gateway.approval.FrontendToolDelegate;
import com.adkstream.gateway.protocol.ChunkLogger;
import com.adkstream.gateway.protocol.SseFormatter;
import com.adkstream.gateway.runtime.AgentRuntime;
import com.adkstream.gateway.session.HistoryReplicator;
import com.adkstream.gateway.session.InMemorySessionBackend;
import com.adkstream.gateway.session.SessionStore;
import com.adkstream.gateway.transport.LiveWebSocketHandler;
import com.adkstream.gateway.transport.TurnStreamer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Spring configuration for gateway beans. The application supplies the
 * {@link AgentRuntime}.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${adkstream.config.path:~/.adkstream/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        String resolvedPath = configPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new ConfigService(Path.of(resolvedPath));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService gatewayScheduler() {
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "adkstream-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public SessionStore sessionStore(ConfigService configService, ScheduledExecutorService gatewayScheduler) {
        StreamConfig config = configService.loadConfig();
        return new SessionStore(new InMemorySessionBackend(), config.getAppName(),
                () -> new ApprovalRegistry(gatewayScheduler));
    }

    @Bean
    public HistoryReplicator historyReplicator(ConfigService configService) {
        return new HistoryReplicator(configService.loadConfig().getAgentName());
    }

    @Bean
    public SseFormatter sseFormatter(ObjectMapper objectMapper) {
        return new SseFormatter(objectMapper);
    }

    @Bean(destroyMethod = "close")
    public ChunkLogger chunkLogger(ConfigService configService, ObjectMapper objectMapper) {
        return ChunkLogger.fromConfig(configService.loadConfig().getChunkLogger(), objectMapper);
    }

    @Bean
    public FrontendToolDelegate frontendToolDelegate(ScheduledExecutorService gatewayScheduler,
            ConfigService configService) {
        return new FrontendToolDelegate(gatewayScheduler,
                Duration.ofMillis(configService.loadConfig().getApproval().getFrontendToolTimeoutMs()));
    }

    @Bean
    public TurnStreamer turnStreamer(AgentRuntime agentRuntime, ChunkLogger chunkLogger) {
        return new TurnStreamer(agentRuntime, chunkLogger);
    }

    @Bean
    public LiveWebSocketHandler liveWebSocketHandler(ObjectMapper objectMapper, ConfigService configService,
            SessionStore sessionStore, HistoryReplicator historyReplicator, TurnStreamer turnStreamer,
            AgentRuntime agentRuntime, FrontendToolDelegate frontendToolDelegate) {
        return new LiveWebSocketHandler(objectMapper, configService, sessionStore, historyReplicator,
                turnStreamer, agentRuntime, frontendToolDelegate);
    }
}
