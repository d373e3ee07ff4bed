package com.linlay.agentchat.config;

import com.linlay.agentchat.session.AgentSessionClient;
import com.linlay.agentchat.session.DetachedAgentSessionClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AgentChatConfiguration {

    /**
     * Single logical event loop for deferred stream completions.
     */
    @Bean(name = "agentEventLoop", destroyMethod = "shutdown")
    public ExecutorService agentEventLoop(AgentSessionProperties properties) {
        String threadName = properties.getEventLoopThreadName();
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock agentClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(AgentSessionClient.class)
    public AgentSessionClient detachedAgentSessionClient() {
        return new DetachedAgentSessionClient();
    }
}
