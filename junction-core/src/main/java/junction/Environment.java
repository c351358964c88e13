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

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;

import junction.core.configuration.ConfigurationReader;
import junction.core.configuration.JunctionConfiguration;
import junction.core.configuration.PropertiesConfigurationReader;
import junction.core.support.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the process-wide default {@link Executor} used to subscribe merged publishers when none is given.
 * <p>
 * The executor is created lazily from the {@link JunctionConfiguration} read at construction time.
 *
 * @since 1.0
 */
public class Environment {

	private static final Logger log = LoggerFactory.getLogger(Environment.class);

	/**
	 * The number of processors available to the runtime
	 *
	 * @see Runtime#availableProcessors()
	 */
	public static final int PROCESSORS = Runtime.getRuntime().availableProcessors() > 1 ?
			Runtime.getRuntime().availableProcessors() :
			2;

	// GLOBAL
	private static final AtomicReference<Environment> environmentReference = new AtomicReference<>();

	/**
	 * Create and assign a context environment bound to the current classloader.
	 *
	 * @return the produced {@link Environment}
	 */
	public static Environment initialize() {
		return assign(new Environment());
	}

	/**
	 * Create and assign a context environment bound to the current classloader only if it not already set.
	 * Otherwise returns the current context environment
	 *
	 * @return the produced {@link Environment}
	 */
	public static Environment initializeIfEmpty() {
		Environment environment = environmentReference.get();
		if (environment != null) {
			return environment;
		}
		environment = new Environment();
		if (environmentReference.compareAndSet(null, environment)) {
			return environment;
		}
		environment.shutdown();
		return get();
	}

	/**
	 * Assign an environment to the context in order to make it available statically in the application from the
	 * current classloader.
	 *
	 * @param environment The environment to assign to the current context
	 * @return the assigned {@link Environment}
	 */
	public static Environment assign(Environment environment) {
		if (!environmentReference.compareAndSet(null, environment)) {
			environment.shutdown();
			throw new IllegalStateException("An environment is already initialized in the current context");
		}
		return environment;
	}

	/**
	 * Read if the context environment has been set
	 *
	 * @return true if context environment is initialized
	 */
	public static boolean alive() {
		return environmentReference.get() != null;
	}

	/**
	 * Read the context environment. It must have been previously assigned with
	 * {@link #assign(Environment)}.
	 *
	 * @return the context environment.
	 * @throws java.lang.IllegalStateException if there is no environment initialized.
	 */
	public static Environment get() throws IllegalStateException {
		Environment environment = environmentReference.get();
		if (environment == null) {
			throw new IllegalStateException("The environment has not been initialized yet");
		}
		return environment;
	}

	/**
	 * Clean and Shutdown the context environment. It must have been previously assigned with
	 * {@link #assign(Environment)}.
	 *
	 * @throws java.lang.IllegalStateException if there is no environment initialized.
	 */
	public static void terminate() throws IllegalStateException {
		Environment environment = environmentReference.getAndSet(null);
		if (environment == null) {
			throw new IllegalStateException("The environment has not been initialized yet");
		}
		environment.shutdown();
	}

	/**
	 * Obtain the default executor, initializing the context environment if needed.
	 *
	 * @return the default executor
	 */
	public static Executor defaultExecutor() {
		return initializeIfEmpty().getDefaultExecutor();
	}

	private final JunctionConfiguration configuration;

	private volatile Executor defaultExecutor;

	/**
	 * Creates a new Environment that will use a {@link PropertiesConfigurationReader} to obtain its initial
	 * configuration.
	 */
	public Environment() {
		this(new PropertiesConfigurationReader());
	}

	public Environment(ConfigurationReader configurationReader) {
		this(configurationReader.read());
	}

	public Environment(JunctionConfiguration configuration) {
		this.configuration = configuration;
	}

	public JunctionConfiguration getConfiguration() {
		return configuration;
	}

	/**
	 * @return the executor subscribing merged publishers, created on first access
	 */
	public Executor getDefaultExecutor() {
		Executor executor = defaultExecutor;
		if (executor == null) {
			synchronized (this) {
				executor = defaultExecutor;
				if (executor == null) {
					executor = createExecutor(configuration);
					defaultExecutor = executor;
				}
			}
		}
		return executor;
	}

	/**
	 * Shutdown the default executor if it has been created.
	 */
	public void shutdown() {
		Executor executor;
		synchronized (this) {
			executor = defaultExecutor;
			defaultExecutor = null;
		}
		if (executor instanceof ExecutorService) {
			log.debug("Shutting down default executor {}", executor);
			((ExecutorService) executor).shutdown();
		}
	}

	static Executor createExecutor(JunctionConfiguration configuration) {
		final int size = configuration.getExecutorSize() > 0 ? configuration.getExecutorSize() : PROCESSORS;
		final String name = configuration.getExecutorName();

		log.debug("Creating {} executor '{}' of size {}", configuration.getExecutorType(), name, size);
		switch (configuration.getExecutorType()) {
			case SYNCHRONOUS:
				return SynchronousExecutor.INSTANCE;
			case FORK_JOIN:
				return new ForkJoinPool(size, new NamedDaemonThreadFactory(name), null, true);
			case THREAD_POOL:
			default:
				return Executors.newFixedThreadPool(size, new NamedDaemonThreadFactory(name));
		}
	}

	/**
	 * Runs tasks on the calling thread.
	 */
	enum SynchronousExecutor implements Executor {
		INSTANCE;

		@Override
		public void execute(Runnable command) {
			command.run();
		}
	}
}
