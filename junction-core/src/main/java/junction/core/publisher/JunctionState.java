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
package junction.core.publisher;

/**
 * Lifecycle of a single merge. {@link #DONE} is terminal.
 *
 * @since 1.0
 */
public enum JunctionState {

	/**
	 * Sources are admitted and their values delivered downstream.
	 */
	RUNNING,

	/**
	 * The downstream subscriber cancelled, waiting for every source to acknowledge cancellation.
	 */
	DOWNSTREAM_CLOSING,

	/**
	 * A source or the source of sources failed, waiting for every other source to acknowledge cancellation.
	 */
	SOURCE_CLOSING,

	/**
	 * Cleanup finished, see {@link JunctionOutcome}.
	 */
	DONE;

	public boolean isClosing() {
		return this == DOWNSTREAM_CLOSING || this == SOURCE_CLOSING;
	}
}
