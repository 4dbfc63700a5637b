package com.inventory.anomaly.config;

import com.inventory.anomaly.engine.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
public class PipelineEngineConfig {

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public ThreadPoolTaskExecutor alertDispatchExecutor(AlertChannelConfig alertConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(alertConfig.getDispatchThreads());
        executor.setMaxPoolSize(alertConfig.getDispatchThreads());
        executor.setThreadNamePrefix("alert-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public RestClient webhookRestClient(RestClient.Builder builder, AlertChannelConfig alertConfig) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(alertConfig.getWebhookTimeout());
        requestFactory.setReadTimeout(alertConfig.getWebhookTimeout());
        return builder.requestFactory(requestFactory).build();
    }
}
