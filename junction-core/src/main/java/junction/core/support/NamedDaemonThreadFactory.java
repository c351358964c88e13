/*
 * Copyright (c) 2011-2016 Pivotal Software Inc, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package junction.core.support;

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the daemon threads of the default merge executor, for a plain thread pool or a {@link ForkJoinPool}.
 * Threads are named {@code prefix-N} and report uncaught errors through the logger.
 *
 * @since 1.0
 */
public class NamedDaemonThreadFactory implements ThreadFactory, ForkJoinPool.ForkJoinWorkerThreadFactory {

	private static final Logger log = LoggerFactory.getLogger(NamedDaemonThreadFactory.class);

	private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER =
			(thread, error) -> log.error("Uncaught error on {}", thread.getName(), error);

	private final AtomicInteger counter = new AtomicInteger();
	private final String        prefix;

	public NamedDaemonThreadFactory(String prefix) {
		this.prefix = prefix;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		return configure(new Thread(runnable));
	}

	@Override
	public ForkJoinWorkerThread newThread(ForkJoinPool pool) {
		return configure(ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool));
	}

	public String getPrefix() {
		return prefix;
	}

	private <W extends Thread> W configure(W thread) {
		thread.setName(prefix + "-" + counter.incrementAndGet());
		thread.setDaemon(true);
		thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
		return thread;
	}
}
