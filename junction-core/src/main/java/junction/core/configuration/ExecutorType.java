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
package junction.core.configuration;

/**
 * An enumeration of the supported types of default merge executor.
 *
 * @since 1.0
 */
public enum ExecutorType {

	/**
	 * A fixed {@link java.util.concurrent.ThreadPoolExecutor} of named daemon threads
	 */
	THREAD_POOL("threadPool"),

	/**
	 * A {@link java.util.concurrent.ForkJoinPool} of named daemon threads
	 */
	FORK_JOIN("forkJoin"),

	/**
	 * Sources are subscribed on the thread admitting them
	 */
	SYNCHRONOUS("synchronous");

	private final String propertyValue;

	ExecutorType(String propertyValue) {
		this.propertyValue = propertyValue;
	}

	/**
	 * @return the value selecting this type in {@code junction.executor.type}
	 */
	public String getPropertyValue() {
		return propertyValue;
	}

	/**
	 * @param value a {@code junction.executor.type} value
	 * @return the matching type or null if not recognized
	 */
	public static ExecutorType fromProperty(String value) {
		for (ExecutorType type : values()) {
			if (type.propertyValue.equals(value)) {
				return type;
			}
		}
		return null;
	}
}
