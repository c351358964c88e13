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
package junction;

import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import junction.core.configuration.ExecutorType;
import junction.core.configuration.JunctionConfiguration;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class EnvironmentTests {

	@Before
	@After
	public void terminateContext() {
		if (Environment.alive()) {
			Environment.terminate();
		}
	}

	@Test
	public void contextEnvironmentIsCreatedOnce() {
		Environment first = Environment.initializeIfEmpty();

		assertThat(Environment.alive(), is(true));
		assertThat(Environment.initializeIfEmpty(), sameInstance(first));
		assertThat(Environment.get(), sameInstance(first));
	}

	@Test(expected = IllegalStateException.class)
	public void assigningTwiceFails() {
		Environment.initialize();
		Environment.assign(new Environment(configuration(ExecutorType.SYNCHRONOUS, 0)));
	}

	@Test(expected = IllegalStateException.class)
	public void getWithoutEnvironmentFails() {
		Environment.get();
	}

	@Test
	public void terminateShutsDownTheDefaultExecutor() {
		Environment.assign(new Environment(configuration(ExecutorType.THREAD_POOL, 1)));
		Executor executor = Environment.defaultExecutor();

		Environment.terminate();

		assertThat(Environment.alive(), is(false));
		assertThat(((ExecutorService) executor).isShutdown(), is(true));
	}

	@Test
	public void threadPoolExecutorUsesNamedDaemonThreads() throws InterruptedException {
		Environment environment = new Environment(configuration(ExecutorType.THREAD_POOL, 2));
		final AtomicReference<Thread> worker = new AtomicReference<>();
		final CountDownLatch latch = new CountDownLatch(1);

		try {
			environment.getDefaultExecutor().execute(() -> {
				worker.set(Thread.currentThread());
				latch.countDown();
			});

			assertThat(latch.await(5, TimeUnit.SECONDS), is(true));
			assertThat(worker.get().getName(), startsWith("test-"));
			assertThat(worker.get().isDaemon(), is(true));
			assertThat(environment.getDefaultExecutor(), sameInstance(environment.getDefaultExecutor()));
		}
		finally {
			environment.shutdown();
		}
	}

	@Test
	public void forkJoinExecutorIsSizedFromConfiguration() throws Exception {
		Executor executor = Environment.createExecutor(configuration(ExecutorType.FORK_JOIN, 3));
		try {
			assertThat(executor, instanceOf(ForkJoinPool.class));
			assertThat(((ForkJoinPool) executor).getParallelism(), is(3));

			Thread worker = ((ForkJoinPool) executor).submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
			assertThat(worker.getName(), startsWith("test-"));
			assertThat(worker.isDaemon(), is(true));
		}
		finally {
			((ForkJoinPool) executor).shutdown();
		}
	}

	@Test
	public void synchronousExecutorRunsOnCallingThread() {
		Environment environment = new Environment(configuration(ExecutorType.SYNCHRONOUS, 0));
		final AtomicReference<Thread> worker = new AtomicReference<>();

		environment.getDefaultExecutor().execute(() -> worker.set(Thread.currentThread()));

		assertThat(worker.get(), sameInstance(Thread.currentThread()));
		environment.shutdown();
	}

	static JunctionConfiguration configuration(ExecutorType type, int size) {
		return new JunctionConfiguration(type, size, "test", new Properties());
	}
}
