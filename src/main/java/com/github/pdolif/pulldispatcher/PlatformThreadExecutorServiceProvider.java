package com.github.pdolif.pulldispatcher;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link ExecutorServiceProvider} that creates cached thread pools of named daemon platform threads.
 * Idle threads are discarded after 60 seconds.
 */
public class PlatformThreadExecutorServiceProvider implements ExecutorServiceProvider {
    @Override
    public ExecutorService createProcessorExecutorService(String dispatcherName) {
        return Executors.newCachedThreadPool(new NamedThreadFactory(dispatcherName + "-processor"));
    }
}
