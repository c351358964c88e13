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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import junction.core.error.Exceptions;
import junction.core.error.SpecificationExceptions;
import junction.core.subscriber.BaseSubscriber;
import junction.core.support.BackpressureUtils;
import org.reactivestreams.Subscription;

/**
 * Subscriber attached to one admitted source. Signals are forwarded to the {@link JunctionCoordinator} mailbox;
 * the producer state and the held value are only read and written from the coordinator drain loop.
 *
 * @param <T> the value type
 * @since 1.0
 */
final class SourceHandle<T> extends BaseSubscriber<T> {

	enum ProducerState {
		/**
		 * One value has been requested (or is about to be, right after subscription).
		 */
		REQUESTING,
		/**
		 * A value arrived while the read-ahead buffer was saturated; no further value is requested.
		 */
		HAS_VALUE,
		CLOSED,
		FAILED
	}

	static final Subscription CANCELLED = new Subscription() {
		@Override
		public void request(long n) {
			//IGNORE
		}

		@Override
		public void cancel() {
			//IGNORE
		}

		@Override
		public String toString() {
			return "CANCELLED";
		}
	};

	final JunctionCoordinator<T> parent;
	final long                   id;

	volatile Subscription subscription;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<SourceHandle, Subscription> SUBSCRIPTION =
	  AtomicReferenceFieldUpdater.newUpdater(SourceHandle.class, Subscription.class, "subscription");

	volatile int cancelled;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<SourceHandle> CANCELLED_FLAG =
	  AtomicIntegerFieldUpdater.newUpdater(SourceHandle.class, "cancelled");

	// drain loop only
	ProducerState state = ProducerState.REQUESTING;
	T             value;
	boolean       completed;
	boolean       ackPending;

	SourceHandle(JunctionCoordinator<T> parent, long id) {
		this.parent = parent;
		this.id = id;
	}

	@Override
	public void onSubscribe(Subscription s) {
		super.onSubscribe(s);
		if (SUBSCRIPTION.compareAndSet(this, null, s)) {
			parent.sourceSubscribed(this);
			return;
		}
		Subscription current = subscription;
		if (current == CANCELLED) {
			Throwable cleanupError = null;
			try {
				s.cancel();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				cleanupError = t;
			}
			parent.cancelAcknowledged(this, cleanupError);
		}
		else {
			BackpressureUtils.checkSubscription(current, s);
		}
	}

	@Override
	public void onNext(T t) {
		if (t == null) {
			parent.sourceFailed(this, SpecificationExceptions.spec_2_13_exception());
			return;
		}
		parent.valueReady(this, t);
	}

	@Override
	public void onError(Throwable t) {
		super.onError(t);
		parent.sourceFailed(this, t);
	}

	@Override
	public void onComplete() {
		parent.sourceCompleted(this);
	}

	/**
	 * Pull the next value. Drain loop only.
	 */
	void request() {
		Subscription s = subscription;
		if (s != null && s != CANCELLED) {
			s.request(1L);
		}
	}

	/**
	 * Back-pressure a value until the buffer has room again. Drain loop only.
	 */
	void hold(T value) {
		this.value = value;
		this.state = ProducerState.HAS_VALUE;
	}

	/**
	 * Give back the held value and get ready for the next pull. Drain loop only.
	 */
	T release() {
		T v = value;
		value = null;
		state = ProducerState.REQUESTING;
		return v;
	}

	/**
	 * @return true if the producer will never signal a value again, on its own
	 */
	boolean isTerminal() {
		return completed || state == ProducerState.CLOSED || state == ProducerState.FAILED;
	}

	/**
	 * Cancel the producer at most once.
	 *
	 * @return true if cancellation is acknowledged, false if the producer has not subscribed yet and will be
	 * cancelled as soon as it does
	 */
	boolean cancel() {
		if (!CANCELLED_FLAG.compareAndSet(this, 0, 1)) {
			return true;
		}
		Subscription s = SUBSCRIPTION.getAndSet(this, CANCELLED);
		if (s == null) {
			return false;
		}
		if (s != CANCELLED) {
			s.cancel();
		}
		return true;
	}

	@Override
	public String toString() {
		return "SourceHandle{id=" + id + ", state=" + state + ", cancelled=" + (cancelled == 1) + "}";
	}
}
