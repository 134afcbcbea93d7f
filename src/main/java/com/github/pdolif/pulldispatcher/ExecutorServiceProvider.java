package com.github.pdolif.pulldispatcher;

import java.util.concurrent.ExecutorService;

/**
 * Interface to provide the {@link ExecutorService} an {@link OrderedPullDispatcher} runs its message processors on.
 * The number of concurrently running processors is bounded by the dispatcher itself, so the provided executor service
 * must not queue tasks indefinitely behind a smaller thread count than the configured max concurrent messages.
 */
@FunctionalInterface
public interface ExecutorServiceProvider {

    /**
     * Creates a new {@link ExecutorService} to be used by the dispatcher with the given name for running message
     * processors. The dispatcher shuts it down when it is closed.
     * @param dispatcherName Name of the dispatcher
     * @return Executor service for message processors
     */
    ExecutorService createProcessorExecutorService(String dispatcherName);
}
