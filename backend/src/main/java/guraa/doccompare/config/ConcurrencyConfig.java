package guraa.doccompare.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for the pool that scores and renders document pairs.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ConcurrencyConfig {

    private final AppProperties appProperties;

    /**
     * Executor for pairwise comparison units. Shut down by the container on close.
     */
    @Bean(name = "comparisonExecutor", destroyMethod = "shutdown")
    public ExecutorService comparisonExecutor() {
        int threads = Math.max(1, appProperties.getConcurrency().getComparisonThreads());
        log.info("Creating comparison executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, createThreadFactory("compare-"));
    }

    /**
     * Create a thread factory with proper naming and error handling.
     *
     * @param prefix Thread name prefix
     * @return A ThreadFactory
     */
    static ThreadFactory createThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadNumber.getAndIncrement());
                thread.setDaemon(false);

                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e));

                return thread;
            }
        };
    }
}
