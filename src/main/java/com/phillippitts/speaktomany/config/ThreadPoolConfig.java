package com.phillippitts.speaktomany.config;

import com.phillippitts.speaktomany.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used in asynchronous processing.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on session count and provider latency.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for outbound translation requests issued by the session coordinator fan-out.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.translation.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - one in-flight request per listener in a typical call</li>
     *   <li>Max pool: default 16 - several concurrent sessions</li>
     *   <li>Queue: default 100 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. When the pool and queue are
     * full the submitter gets a {@link java.util.concurrent.RejectedExecutionException} and
     * counts that request as failed. Work never runs on the submitting thread, so a saturated
     * pool cannot stall the buffer's drain thread or bypass the per-request timeout.
     *
     * @return configured executor for translation calls
     */
    @Bean(name = "translationExecutor")
    public Executor translationExecutor() {
        return buildExecutor(threadPoolProperties.getTranslation());
    }

    /**
     * Executor for translation buffer listener callbacks.
     *
     * <p>Keeps slow listeners off the buffer's drain thread so forced dispatch stays on time.
     *
     * @return configured executor for segment dispatch
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        return buildExecutor(threadPoolProperties.getDispatch());
    }

    private static Executor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext of the submitting thread to the worker thread so session,
     * participant and segment ids survive the hop.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
