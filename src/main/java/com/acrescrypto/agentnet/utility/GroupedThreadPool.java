package com.acrescrypto.agentnet.utility;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

public class GroupedThreadPool {
	public ThreadGroup threadGroup;
	protected ExecutorService executor;

	public static GroupedThreadPool newCachedThreadPool(String name) {
		return newCachedThreadPool(Thread.currentThread().getThreadGroup(), name);
	}

	public static GroupedThreadPool newCachedThreadPool(ThreadGroup parent, String name) {
		return new GroupedThreadPool(parent, name);
	}

	public GroupedThreadPool(ThreadGroup parent, String name) {
		threadGroup = new ThreadGroup(parent, name);
		ThreadFactory factory = new ThreadFactory() {
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(threadGroup, ()->{
					Util.setThreadName(name + " active thread");
					try {
						r.run();
					} finally {
						Util.setThreadName(name + " idle thread");
					}
				});

				// receive loops must not hold the JVM open once their owner is gone
				thread.setDaemon(true);
				return thread;
			}
		};

		executor = Executors.newCachedThreadPool(factory);
	}

	public Future<?> submit(Runnable task) {
		return executor.submit(task);
	}

	/** Stop accepting work; running tasks are left to finish on their own. */
	public void shutdown() {
		executor.shutdown();
	}

	public boolean isShutdown() {
		return executor.isShutdown();
	}
}
