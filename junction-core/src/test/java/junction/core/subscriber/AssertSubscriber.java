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
package junction.core.subscriber;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

import junction.core.publisher.MergeState;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Records every signal it receives. An optional hook runs on each value with access to the subscription.
 */
public class AssertSubscriber<T> implements Subscriber<T> {

	public static <T> AssertSubscriber<T> create() {
		return new AssertSubscriber<>(Long.MAX_VALUE);
	}

	public static <T> AssertSubscriber<T> create(long initialRequest) {
		return new AssertSubscriber<>(initialRequest);
	}

	private final long initialRequest;

	private final List<T>        values        = new ArrayList<>();
	private final AtomicInteger  completeCount = new AtomicInteger();
	private final AtomicInteger  errorCount    = new AtomicInteger();
	private final CountDownLatch terminated    = new CountDownLatch(1);

	private volatile Subscription subscription;
	private volatile Throwable    error;

	private volatile BiConsumer<AssertSubscriber<T>, T> onNextHook;

	AssertSubscriber(long initialRequest) {
		this.initialRequest = initialRequest;
	}

	public AssertSubscriber<T> onNextHook(BiConsumer<AssertSubscriber<T>, T> hook) {
		this.onNextHook = hook;
		return this;
	}

	@Override
	public void onSubscribe(Subscription s) {
		subscription = s;
		if (initialRequest > 0) {
			s.request(initialRequest);
		}
	}

	@Override
	public void onNext(T t) {
		synchronized (values) {
			values.add(t);
		}
		BiConsumer<AssertSubscriber<T>, T> hook = onNextHook;
		if (hook != null) {
			hook.accept(this, t);
		}
	}

	@Override
	public void onError(Throwable t) {
		error = t;
		errorCount.incrementAndGet();
		terminated.countDown();
	}

	@Override
	public void onComplete() {
		completeCount.incrementAndGet();
		terminated.countDown();
	}

	public void request(long n) {
		subscription.request(n);
	}

	public void cancel() {
		subscription.cancel();
	}

	public MergeState mergeState() {
		return (MergeState) subscription;
	}

	public List<T> values() {
		synchronized (values) {
			return new ArrayList<>(values);
		}
	}

	public int valueCount() {
		synchronized (values) {
			return values.size();
		}
	}

	public Throwable error() {
		return error;
	}

	public int errorCount() {
		return errorCount.get();
	}

	public int completeCount() {
		return completeCount.get();
	}

	public boolean isTerminated() {
		return terminated.getCount() == 0;
	}

	/**
	 * Wait for onComplete or onError.
	 *
	 * @throws AssertionError if no terminal signal arrives in time
	 */
	public AssertSubscriber<T> awaitTerminated(long timeout, TimeUnit unit) throws InterruptedException {
		if (!terminated.await(timeout, unit)) {
			throw new AssertionError("No terminal signal received within " + timeout + " " + unit +
					", received " + valueCount() + " values");
		}
		return this;
	}
}
