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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Emits {@code [start, start + count)} from its own task, one value per unit of demand. Tracks how many instances
 * are open at the same time.
 */
final class AsyncRangePublisher implements Publisher<Integer> {

	private final int             start;
	private final int             count;
	private final ExecutorService emitters;
	private final AtomicInteger   open;
	private final AtomicInteger   peak;

	AsyncRangePublisher(int start, int count, ExecutorService emitters, AtomicInteger open, AtomicInteger peak) {
		this.start = start;
		this.count = count;
		this.emitters = emitters;
		this.open = open;
		this.peak = peak;
	}

	@Override
	public void subscribe(final Subscriber<? super Integer> s) {
		int current = open.incrementAndGet();
		peak.accumulateAndGet(current, Math::max);

		final Semaphore demand = new Semaphore(0);
		final AtomicInteger cancelled = new AtomicInteger();

		s.onSubscribe(new Subscription() {
			@Override
			public void request(long n) {
				demand.release((int) Math.min(n, Integer.MAX_VALUE / 2));
			}

			@Override
			public void cancel() {
				if (cancelled.compareAndSet(0, 1)) {
					open.decrementAndGet();
					demand.release();
				}
			}
		});

		emitters.execute(() -> {
			try {
				for (int i = start; i < start + count; i++) {
					demand.acquire();
					if (cancelled.get() != 0) {
						return;
					}
					s.onNext(i);
				}
				if (cancelled.compareAndSet(0, 1)) {
					open.decrementAndGet();
					s.onComplete();
				}
			}
			catch (InterruptedException ie) {
				Thread.currentThread().interrupt();
			}
		});
	}
}
