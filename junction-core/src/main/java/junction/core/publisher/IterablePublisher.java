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

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import junction.core.error.Exceptions;
import junction.core.error.SpecificationExceptions;
import junction.core.support.BackpressureUtils;
import junction.core.support.EmptySubscription;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Emits the values of an {@link Iterable} on the requesting thread, no more than requested.
 *
 * @param <T> the value type
 * @since 1.0
 */
public final class IterablePublisher<T> implements Publisher<T> {

	private final Iterable<? extends T> values;

	public IterablePublisher(Iterable<? extends T> values) {
		if (values == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		this.values = values;
	}

	@Override
	public void subscribe(Subscriber<? super T> s) {
		if (s == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		Iterator<? extends T> it;
		try {
			it = values.iterator();
		}
		catch (Throwable t) {
			Exceptions.<T>publisher(t).subscribe(s);
			return;
		}
		if (!it.hasNext()) {
			s.onSubscribe(EmptySubscription.INSTANCE);
			s.onComplete();
			return;
		}
		s.onSubscribe(new IteratorSubscription<>(s, it));
	}

	@Override
	public String toString() {
		return "iterable=" + values;
	}

	static final class IteratorSubscription<T> implements Subscription {

		final Subscriber<? super T>  actual;
		final Iterator<? extends T> iterator;

		volatile boolean cancelled;

		volatile long requested;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<IteratorSubscription> REQUESTED =
		  AtomicLongFieldUpdater.newUpdater(IteratorSubscription.class, "requested");

		IteratorSubscription(Subscriber<? super T> actual, Iterator<? extends T> iterator) {
			this.actual = actual;
			this.iterator = iterator;
		}

		@Override
		public void request(long n) {
			if (n <= 0L) {
				cancelled = true;
				actual.onError(SpecificationExceptions.spec_3_09_exception(n));
				return;
			}
			if (BackpressureUtils.getAndAdd(REQUESTED, this, n) == 0L) {
				slowPath(n);
			}
		}

		void slowPath(long n) {
			long e = 0L;
			for (; ; ) {
				while (e != n) {
					if (cancelled) {
						return;
					}
					T value;
					boolean hasNext;
					try {
						value = iterator.next();
						if (value == null) {
							throw SpecificationExceptions.spec_2_13_exception();
						}
						actual.onNext(value);
						if (cancelled) {
							return;
						}
						hasNext = iterator.hasNext();
					}
					catch (Throwable t) {
						Exceptions.throwIfFatal(t);
						cancelled = true;
						actual.onError(t);
						return;
					}
					if (!hasNext) {
						cancelled = true;
						actual.onComplete();
						return;
					}
					e++;
				}

				n = requested;
				if (n == e) {
					n = REQUESTED.addAndGet(this, -e);
					if (n == 0L) {
						return;
					}
					e = 0L;
				}
			}
		}

		@Override
		public void cancel() {
			cancelled = true;
		}
	}
}
