package io.github.drompincen.strata.runtime.config;

import io.github.drompincen.strata.runtime.session.ChatSessionFactory;
import io.github.drompincen.strata.tools.ToolInterpreterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeConfiguration {

    /** Single thread, so bridge events reach sessions in the order they were written. */
    @Bean
    ThreadPoolTaskExecutor bridgeDispatcher() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("bridge-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    @Bean
    ThreadPoolTaskScheduler bridgeScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("bridge-retry-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean
    ToolInterpreterRegistry toolInterpreterRegistry() {
        return ToolInterpreterRegistry.loadDefault();
    }

    @Bean
    ChatSessionFactory chatSessionFactory(BridgeProperties properties,
                                          @Qualifier("bridgeDispatcher") ThreadPoolTaskExecutor dispatcher,
                                          @Qualifier("bridgeScheduler") ThreadPoolTaskScheduler scheduler,
                                          ToolInterpreterRegistry interpreters) {
        return new ChatSessionFactory(properties, dispatcher, scheduler.getScheduledExecutor(), interpreters);
    }
}
