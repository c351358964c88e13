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
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import junction.core.error.Exceptions;
import junction.core.subscriber.BaseSubscriber;
import junction.core.support.BackpressureUtils;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;

/**
 * Subscriber attached to the source of sources. Sources are pulled one at a time and only while a slot is free,
 * so sources are never instantiated eagerly. Sources signalled beyond that, by a source of sources ignoring
 * demand, wait in a FIFO queue until a slot frees.
 * <p>
 * Apart from the signal callbacks, every method runs in the {@link JunctionCoordinator} drain loop.
 *
 * @param <T> the merged value type
 * @since 1.0
 */
final class AdmissionController<T> extends BaseSubscriber<Publisher<? extends T>> {

	final JunctionCoordinator<T> parent;
	final int                    maxOpen;

	volatile Subscription subscription;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<AdmissionController, Subscription> SUBSCRIPTION =
	  AtomicReferenceFieldUpdater.newUpdater(AdmissionController.class, Subscription.class, "subscription");

	// drain loop only
	final ArrayDeque<Publisher<? extends T>> pending = new ArrayDeque<>();

	boolean subscribed;
	boolean outstanding;
	boolean exhausted;
	boolean failed;
	boolean ackPending;

	AdmissionController(JunctionCoordinator<T> parent, int maxOpen) {
		this.parent = parent;
		this.maxOpen = maxOpen;
	}

	@Override
	public void onSubscribe(Subscription s) {
		super.onSubscribe(s);
		if (SUBSCRIPTION.compareAndSet(this, null, s)) {
			parent.sourcesSubscribed();
			return;
		}
		Subscription current = subscription;
		if (current == SourceHandle.CANCELLED) {
			Throwable cleanupError = null;
			try {
				s.cancel();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				cleanupError = t;
			}
			parent.cancelAcknowledged(null, cleanupError);
		}
		else {
			BackpressureUtils.checkSubscription(current, s);
		}
	}

	@Override
	public void onNext(Publisher<? extends T> source) {
		parent.sourceArrived(source);
	}

	@Override
	public void onError(Throwable t) {
		super.onError(t);
		parent.sourcesFailed(t);
	}

	@Override
	public void onComplete() {
		parent.sourcesCompleted();
	}

	boolean hasCapacity() {
		return maxOpen <= 0 || parent.active.size() < maxOpen;
	}

	/**
	 * A source arrived: admit it now if a slot is free, queue it otherwise.
	 */
	void onNewSource(Publisher<? extends T> source) {
		outstanding = false;
		pending.offer(source);
		admitPending();
	}

	/**
	 * A source has been retired.
	 */
	void onSlotFreed() {
		admitPending();
	}

	void admitPending() {
		while (!pending.isEmpty() && hasCapacity() && parent.state == JunctionState.RUNNING) {
			parent.admit(pending.poll());
		}
	}

	/**
	 * Pull the next source if nothing is queued, no pull is in flight and a slot is free.
	 */
	void requestNextIfAllowed() {
		if (subscribed && !exhausted && !failed && !outstanding && pending.isEmpty() && hasCapacity()) {
			Subscription s = subscription;
			if (s != null && s != SourceHandle.CANCELLED) {
				outstanding = true;
				s.request(1L);
			}
		}
	}

	boolean isTerminated() {
		return exhausted || failed;
	}

	/**
	 * @return true if no more source will ever be admitted
	 */
	boolean isDrained() {
		return exhausted && pending.isEmpty();
	}

	int clearPending() {
		int dropped = pending.size();
		pending.clear();
		return dropped;
	}

	/**
	 * Stop pulling sources, at most once.
	 *
	 * @return true if acknowledged, false if the source of sources has not subscribed yet
	 */
	boolean cancel() {
		Subscription s = SUBSCRIPTION.getAndSet(this, SourceHandle.CANCELLED);
		if (s == null) {
			return false;
		}
		if (s != SourceHandle.CANCELLED) {
			s.cancel();
		}
		return true;
	}

	@Override
	public String toString() {
		return "AdmissionController{maxOpen=" + maxOpen +
				", pending=" + pending.size() +
				", exhausted=" + exhausted +
				"}";
	}
}
