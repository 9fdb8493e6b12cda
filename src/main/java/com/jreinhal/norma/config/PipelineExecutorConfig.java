package com.jreinhal.norma.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for the two fan-out points of a request: retrieval strategies
 * and model calls (reasoning hypotheses, per-call timeouts).
 *
 * <p>Both pools copy the submitting thread's MDC into the worker so that
 * {@code requestId}/{@code sessionId} reach logs and cost accounting.</p>
 *
 * <p>Rejections are logged and thrown as {@link RejectedExecutionException};
 * callers treat them like any other failed sub-operation.</p>
 */
@Configuration
public class PipelineExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutorConfig.class);

    @Bean(name = {"ragExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor ragExecutor(
            @Value("${norma.performance.rag-core-threads:4}") int coreThreads,
            @Value("${norma.performance.rag-max-threads:8}") int maxThreads,
            @Value("${norma.performance.rag-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("rag-exec-", coreThreads, maxThreads, queueCapacity);
    }

    @Bean(name = {"reasoningExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor reasoningExecutor(
            @Value("${norma.performance.reasoning-threads:8}") int threads) {
        return this.buildExecutor("llm-exec-", threads, threads, Math.max(50, threads * 10));
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new MdcPropagatingThreadPoolExecutor(core, max, queue,
                new NamedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    /**
     * Restores the caller's MDC inside the worker and clears it afterwards.
     */
    static final class MdcPropagatingThreadPoolExecutor extends ThreadPoolExecutor {

        MdcPropagatingThreadPoolExecutor(int core, int max, int queueCapacity, ThreadFactory threadFactory,
                                         RejectedExecutionHandler handler) {
            super(core, max, 30L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(queueCapacity), threadFactory, handler);
        }

        @Override
        public void execute(Runnable command) {
            Map<String, String> parentMdc = MDC.getCopyOfContextMap();
            super.execute(() -> {
                if (parentMdc != null) {
                    MDC.setContextMap(parentMdc);
                }
                try {
                    command.run();
                } finally {
                    MDC.clear();
                }
            });
        }
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}': active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(),
                    executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' saturated (" + count + " rejections)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
