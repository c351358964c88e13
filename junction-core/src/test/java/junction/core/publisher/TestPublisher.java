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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * A publisher driven by the test: values and terminal signals are emitted on demand of the test, while requests
 * and cancellations are recorded.
 */
public final class TestPublisher<T> implements Publisher<T> {

	private final String name;

	private final AtomicInteger subscribeCount = new AtomicInteger();
	private final AtomicLong    requested      = new AtomicLong();
	private final AtomicLong    totalRequested = new AtomicLong();
	private final AtomicInteger cancelCount    = new AtomicInteger();

	private volatile Subscriber<? super T> subscriber;
	private volatile RuntimeException      cancelError;

	public TestPublisher(String name) {
		this.name = name;
	}

	/**
	 * Make {@link Subscription#cancel()} throw the given error.
	 */
	public TestPublisher<T> throwOnCancel(RuntimeException error) {
		this.cancelError = error;
		return this;
	}

	@Override
	public void subscribe(Subscriber<? super T> s) {
		subscribeCount.incrementAndGet();
		subscriber = s;
		s.onSubscribe(new Subscription() {
			@Override
			public void request(long n) {
				requested.addAndGet(n);
				totalRequested.addAndGet(n);
			}

			@Override
			public void cancel() {
				cancelCount.incrementAndGet();
				RuntimeException e = cancelError;
				if (e != null) {
					throw e;
				}
			}
		});
	}

	@SafeVarargs
	public final TestPublisher<T> emit(T... values) {
		for (T value : values) {
			requested.decrementAndGet();
			subscriber.onNext(value);
		}
		return this;
	}

	public TestPublisher<T> complete() {
		subscriber.onComplete();
		return this;
	}

	public TestPublisher<T> error(Throwable error) {
		subscriber.onError(error);
		return this;
	}

	public boolean isSubscribed() {
		return subscribeCount.get() > 0;
	}

	public int subscribeCount() {
		return subscribeCount.get();
	}

	/**
	 * @return the outstanding demand
	 */
	public long requested() {
		return requested.get();
	}

	public long totalRequested() {
		return totalRequested.get();
	}

	public int cancelCount() {
		return cancelCount.get();
	}

	@Override
	public String toString() {
		return "TestPublisher{" + name + "}";
	}
}
