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

import java.util.ArrayDeque;

/**
 * Values pulled from sources ahead of downstream demand, oldest first. Each value is accepted against the limit
 * in force at that moment, the number of active sources.
 * <p>
 * Not thread-safe, only touched from the merge drain loop.
 *
 * @param <T> the value type
 * @since 1.0
 */
final class ReadAheadBuffer<T> {

	private final ArrayDeque<T> values = new ArrayDeque<>();

	/**
	 * Append a value if the buffer holds less than {@code limit} values.
	 *
	 * @param value the value to read ahead
	 * @param limit the current number of active sources
	 * @return true if accepted, false if the caller must hold the value back
	 */
	boolean offer(T value, int limit) {
		if (values.size() >= limit) {
			return false;
		}
		values.offer(value);
		return true;
	}

	boolean hasRoom(int limit) {
		return values.size() < limit;
	}

	/**
	 * @return the oldest value or null if empty
	 */
	T poll() {
		return values.poll();
	}

	boolean isEmpty() {
		return values.isEmpty();
	}

	int size() {
		return values.size();
	}

	/**
	 * Drop every buffered value.
	 *
	 * @return the number of dropped values
	 */
	int clear() {
		int dropped = values.size();
		values.clear();
		return dropped;
	}

	@Override
	public String toString() {
		return "ReadAheadBuffer{size=" + values.size() + "}";
	}
}
