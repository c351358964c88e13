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

import java.util.Properties;

/**
 * An encapsulation of configuration for Junction
 *
 * @since 1.0
 */
public class JunctionConfiguration {

	private final ExecutorType executorType;

	private final int executorSize;

	private final String executorName;

	private final Properties properties;

	public JunctionConfiguration(ExecutorType executorType, int executorSize, String executorName,
			Properties properties) {
		if (executorType == null || executorName == null || properties == null) {
			throw new IllegalArgumentException("'executorType', 'executorName' and 'properties' must not be null");
		}
		if (executorSize < 0) {
			throw new IllegalArgumentException("'executorSize' must not be negative: " + executorSize);
		}
		this.executorType = executorType;
		this.executorSize = executorSize;
		this.executorName = executorName;
		this.properties = properties;
	}

	/**
	 * @return The type of the default merge executor. Never {@code null}.
	 */
	public ExecutorType getExecutorType() {
		return executorType;
	}

	/**
	 * Returns the number of threads of the default executor, {@code 0} meaning one per available processor.
	 *
	 * @return The executor size
	 */
	public int getExecutorSize() {
		return executorSize;
	}

	/**
	 * @return The prefix of the default executor thread names. Never {@code null}.
	 */
	public String getExecutorName() {
		return executorName;
	}

	/**
	 * Additional configuration properties. Never {@code null}.
	 *
	 * @return The additional configuration properties.
	 */
	public Properties getAdditionalProperties() {
		return properties;
	}

	@Override
	public String toString() {
		return "JunctionConfiguration{" +
				"executorType=" + executorType +
				", executorSize=" + executorSize +
				", executorName='" + executorName + '\'' +
				'}';
	}
}
