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

import java.util.concurrent.Executor;

import junction.core.error.Exceptions;
import junction.core.error.SpecificationExceptions;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

/**
 * Merges the publishers emitted by a source of publishers. Every subscription runs an independent merge driven
 * by its own {@link JunctionCoordinator}.
 * <p>
 * Merging stops when the source of publishers and every admitted publisher completed and the read-ahead buffer
 * has been consumed. It also stops when the downstream subscriber cancels, in which case every active publisher
 * and the source of publishers are cancelled. When any of them fails, the others are cancelled and the merge
 * fails with the first error observed once every cancellation has been acknowledged.
 * <p>
 * Merging is non-deterministic but fair: every publisher is consulted once it has a value ready, so faster
 * publishers provide their values more often than slower ones. Values are read ahead into a small buffer bounded
 * by the number of active publishers.
 *
 * @param <T> the merged value type
 * @since 1.0
 */
public final class MergeJunction<T> implements Publisher<T> {

	private final Publisher<? extends Publisher<? extends T>> source;
	private final int                                         maxOpen;
	private final Executor                                    executor;

	/**
	 * @param source   the source of publishers to merge
	 * @param maxOpen  the maximum number of publishers subscribed at the same time, unbounded if {@code <= 0}
	 * @param executor the executor subscribing admitted publishers
	 */
	public MergeJunction(Publisher<? extends Publisher<? extends T>> source, int maxOpen, Executor executor) {
		if (source == null || executor == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		this.source = source;
		this.maxOpen = maxOpen > 0 ? maxOpen : 0;
		this.executor = executor;
	}

	@Override
	public void subscribe(Subscriber<? super T> subscriber) {
		if (subscriber == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		JunctionCoordinator<T> coordinator = new JunctionCoordinator<>(subscriber, maxOpen, executor);
		subscriber.onSubscribe(coordinator);
		try {
			source.subscribe(coordinator.admission);
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			coordinator.sourcesFailed(t);
		}
	}

	/**
	 * @return the maximum number of publishers subscribed at the same time, 0 if unbounded
	 */
	public int getMaxOpen() {
		return maxOpen;
	}

	public Executor getExecutor() {
		return executor;
	}

	@Override
	public String toString() {
		return "MergeJunction{maxOpen=" + maxOpen + ", executor=" + executor + "}";
	}
}
