package com.example.compliance.config;

import com.example.compliance.service.ResilientCaller;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Model clients, retry wrapper, job executor and the shared ObjectMapper.
 * <p>
 * - analysisChatClient (OpenAI): structured compliance analysis
 * - judgeChatClient (Anthropic): model-as-judge evaluation of the analysis
 */
@Configuration
public class AiConfig {

    @Bean("analysisChatClient")
    public ChatClient analysisChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean("judgeChatClient")
    public ChatClient judgeChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    /**
     * Backoff shared by every embedding and chat call.
     */
    @Bean
    public ResilientCaller resilientCaller(ComplianceProperties properties) {
        ComplianceProperties.Retry retry = properties.retry();
        return new ResilientCaller(retry.maxAttempts(), retry.baseDelay());
    }

    /**
     * Bounded pool running analysis jobs, one job per thread.
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor analysisExecutor(ComplianceProperties properties) {
        ComplianceProperties.Executor config = properties.executor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.corePoolSize());
        executor.setMaxPoolSize(config.maxPoolSize());
        executor.setQueueCapacity(config.queueCapacity());
        executor.setThreadNamePrefix("analysis-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
