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
 * Read-only view over a running merge, implemented by the {@link org.reactivestreams.Subscription} handed to the
 * downstream subscriber.
 * <p>
 * Counts are exact when read from the thread delivering signals downstream (e.g. from within
 * {@code onNext}), and a recent snapshot otherwise.
 *
 * @since 1.0
 */
public interface MergeState {

	/**
	 * @return number of admitted sources that have not been retired yet
	 */
	int activeCount();

	/**
	 * @return number of sources received from the source of sources and waiting for a free slot
	 */
	int pendingCount();

	/**
	 * @return number of values read ahead of downstream demand
	 */
	int bufferedCount();

	/**
	 * @return the maximum number of simultaneously active sources, 0 if unbounded
	 */
	int maxOpen();

	JunctionState state();

	/**
	 * @return the terminal outcome, null until {@link JunctionState#DONE}
	 */
	JunctionOutcome outcome();
}
