package org.qubership.cloud.solrbackup.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Pool for Solr calls of the collections of a backup run. Shared by all backup requests.
 */
@Slf4j
@ApplicationScoped
public class AsyncOperations {
    private static final String THREAD_PREFIX = "solr-collection-backup-";

    @ConfigProperty(name = "solr-backup.collections.pool-size", defaultValue = "10")
    int collectionPoolSize;

    private ThreadPoolExecutor collectionExecutor;

    public AsyncOperations() {
    }

    AsyncOperations(int collectionPoolSize) {
        this.collectionPoolSize = collectionPoolSize;
        initPools();
    }

    @PostConstruct
    void initPools() {
        log.info("Start collection backup pool with {} threads", collectionPoolSize);
        collectionExecutor = new ThreadPoolExecutor(
                collectionPoolSize,
                collectionPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new PrefixedThreadFactory(THREAD_PREFIX));
    }

    @PreDestroy
    void shutdown() {
        collectionExecutor.shutdown();
    }

    public ExecutorService getCollectionPool() {
        return collectionExecutor;
    }

    static class PrefixedThreadFactory implements ThreadFactory {
        private final ThreadFactory delegate = Executors.defaultThreadFactory();
        private final String prefix;

        PrefixedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = delegate.newThread(task);
            thread.setName(prefix + thread.getName());
            thread.setDaemon(true);
            return thread;
        }
    }
}
