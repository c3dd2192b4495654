package com.example.sfera.autoconfig;

import com.example.sfera.config.SferaMemoryProperties;
import com.example.sfera.config.SferaProactiveProperties;
import com.example.sfera.infra.exec.ContextAwareExecutorService;
import com.example.sfera.memory.MemoryBootstrapLoader;
import com.example.sfera.memory.SessionSummarizer;
import com.example.sfera.memory.SummaryStore;
import com.example.sfera.memory.UserStateStore;
import com.example.sfera.memory.VectorMemoryStore;
import com.example.sfera.proactive.ProactiveFollowUpJob;
import com.example.sfera.proactive.ProactiveMessageSender;
import com.example.sfera.session.SessionLifecycleService;
import com.example.sfera.session.SessionRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Memory bootstrap, session lifecycle and proactive follow-ups. Active only when the
 * application supplies the memory stores.
 */
@AutoConfiguration(after = SferaGovernanceAutoConfiguration.class)
@EnableConfigurationProperties({ SferaMemoryProperties.class, SferaProactiveProperties.class })
@ConditionalOnBean({ UserStateStore.class, SummaryStore.class, VectorMemoryStore.class })
public class SferaMemoryAutoConfiguration {

    /**
     * Executor for the parallel memory fetches.
     *
     * <p>Bounded queue with fail-fast rejection: a rejected submission surfaces as a
     * memory load failure instead of queueing without limit. The MDC of the caller follows
     * each fetch onto the worker thread.</p>
     */
    @Bean(name = "memoryLoadExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "memoryLoadExecutor")
    public ExecutorService memoryLoadExecutor(SferaMemoryProperties props) {
        AtomicInteger counter = new AtomicInteger(0);
        int nThreads = props.getLoaderThreads();
        ThreadPoolExecutor delegate = new ThreadPoolExecutor(
                nThreads,
                nThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(props.getLoaderQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "memory-load-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()) {
            @Override
            protected void beforeExecute(Thread t, Runnable r) {
                if (t.isInterrupted()) {
                    Thread.interrupted(); // clear interrupt left by a cancelled task
                }
                super.beforeExecute(t, r);
            }
        };
        return new ContextAwareExecutorService(delegate);
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryBootstrapLoader memoryBootstrapLoader(
            UserStateStore userStateStore,
            SummaryStore summaryStore,
            VectorMemoryStore vectorMemoryStore,
            @Qualifier("memoryLoadExecutor") ExecutorService memoryLoadExecutor,
            SferaMemoryProperties props) {
        return new MemoryBootstrapLoader(
                userStateStore,
                summaryStore,
                vectorMemoryStore,
                memoryLoadExecutor,
                props.getHistoryFetchLimit(),
                props.getReplayLimit(),
                props.getGreetingInstruction());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SessionSummarizer.class)
    public SessionLifecycleService sessionLifecycleService(
            MemoryBootstrapLoader memoryBootstrapLoader,
            SessionRegistry sessionRegistry,
            VectorMemoryStore vectorMemoryStore,
            SummaryStore summaryStore,
            SessionSummarizer summarizer,
            SferaMemoryProperties props) {
        return new SessionLifecycleService(
                memoryBootstrapLoader,
                sessionRegistry,
                vectorMemoryStore,
                summaryStore,
                summarizer,
                props.getOnFailure());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ProactiveMessageSender.class)
    @ConditionalOnProperty(name = "sfera.proactive.enabled", havingValue = "true", matchIfMissing = true)
    public ProactiveFollowUpJob proactiveFollowUpJob(
            UserStateStore userStateStore,
            SessionRegistry sessionRegistry,
            ProactiveMessageSender sender,
            SferaProactiveProperties props,
            Clock clock) {
        return new ProactiveFollowUpJob(userStateStore, sessionRegistry, sender, props, clock);
    }
}
