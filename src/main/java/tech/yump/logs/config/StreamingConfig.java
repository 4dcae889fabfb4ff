package tech.yump.logs.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;
import java.time.Duration;

/**
 * Runs streaming responses on a dedicated bounded pool instead of the servlet
 * container's request threads.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class StreamingConfig implements WebMvcConfigurer {

    // Lets a follow that hit its maximum duration finish writing before the container times out
    static final Duration ASYNC_TIMEOUT_GRACE = Duration.ofSeconds(30);

    private final LiteLogsProperties properties;

    @Bean
    public ThreadPoolTaskExecutor logStreamExecutor() {
        LiteLogsProperties.StreamProperties.ExecutorProperties executorProps = properties.stream().executor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("log-stream-");
        executor.setCorePoolSize(executorProps.coreSize());
        executor.setMaxPoolSize(executorProps.maxSize());
        executor.setQueueCapacity(executorProps.queueCapacity());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("Log stream executor configured: core={}, max={}, queue={}",
                executorProps.coreSize(), executorProps.maxSize(), executorProps.queueCapacity());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        Duration timeout = properties.stream().maxFollowDuration().plus(ASYNC_TIMEOUT_GRACE);
        configurer.setTaskExecutor(logStreamExecutor());
        configurer.setDefaultTimeout(timeout.toMillis());
        log.debug("Async request timeout set to {}", timeout);
    }
}
