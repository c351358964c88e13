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
 * A {@code ConfigurationReader} is used to read Junction configuration.
 *
 * @since 1.0
 */
public interface ConfigurationReader {

	/**
	 * Reads the configuration
	 *
	 * @return The configuration. Never {@code null}.
	 */
	JunctionConfiguration read();
}
