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
package junction;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.Executor;

import junction.core.error.Exceptions;
import junction.core.publisher.IterablePublisher;
import junction.core.publisher.MergeJunction;
import org.reactivestreams.Publisher;

/**
 * Static entry points to merge a dynamic population of publishers into a single {@link Publisher}.
 * <p>
 * Values from a single publisher keep their order, values from different publishers are interleaved as they
 * become ready.
 *
 * @since 1.0
 */
public abstract class Junctions {

	/**
	 * Merge every publisher emitted by {@code sources}, subscribing each as soon as it arrives. Sources are
	 * subscribed on the {@link Environment#defaultExecutor() default executor}.
	 *
	 * @param sources the source of publishers
	 * @param <T>     the merged value type
	 * @return a merged {@link Publisher}
	 */
	public static <T> Publisher<T> merge(Publisher<? extends Publisher<? extends T>> sources) {
		return merge(sources, 0);
	}

	/**
	 * Merge the publishers emitted by {@code sources}, with at most {@code maxOpen} of them subscribed at any
	 * time. A {@code maxOpen <= 0} does not limit the number of subscribed publishers. Sources are subscribed on
	 * the {@link Environment#defaultExecutor() default executor}.
	 *
	 * @param sources the source of publishers
	 * @param maxOpen the maximum number of publishers subscribed at the same time
	 * @param <T>     the merged value type
	 * @return a merged {@link Publisher}
	 */
	public static <T> Publisher<T> merge(Publisher<? extends Publisher<? extends T>> sources, int maxOpen) {
		return merge(sources, maxOpen, Environment.defaultExecutor());
	}

	/**
	 * @param sources  the source of publishers
	 * @param executor the executor subscribing admitted publishers
	 * @param <T>      the merged value type
	 * @return a merged {@link Publisher}
	 * @see #merge(Publisher, int, Executor)
	 */
	public static <T> Publisher<T> merge(Publisher<? extends Publisher<? extends T>> sources, Executor executor) {
		return merge(sources, 0, executor);
	}

	/**
	 * @param sources  the source of publishers
	 * @param maxOpen  the maximum number of publishers subscribed at the same time, unbounded if {@code <= 0}
	 * @param executor the executor subscribing admitted publishers
	 * @param <T>      the merged value type
	 * @return a merged {@link Publisher}
	 */
	public static <T> Publisher<T> merge(Publisher<? extends Publisher<? extends T>> sources,
			int maxOpen,
			Executor executor) {
		return new MergeJunction<>(sources, maxOpen, executor);
	}

	/**
	 * Merge a fixed set of publishers.
	 *
	 * @param publishers the publishers to merge
	 * @param <T>        the merged value type
	 * @return a merged {@link Publisher}
	 */
	public static <T> Publisher<T> merge(Iterable<? extends Publisher<? extends T>> publishers) {
		return Junctions.<T>merge(Junctions.<Publisher<? extends T>>from(publishers));
	}

	/**
	 * Merge a fixed set of publishers.
	 *
	 * @param publishers the publishers to merge
	 * @param <T>        the merged value type
	 * @return a merged {@link Publisher}
	 */
	@SafeVarargs
	public static <T> Publisher<T> merge(Publisher<? extends T>... publishers) {
		return Junctions.<T>merge(Arrays.asList(publishers));
	}

	/**
	 * @param values the values to emit, honouring demand
	 * @param <T>    the value type
	 * @return a {@link Publisher} of the given values
	 */
	public static <T> Publisher<T> from(Iterable<? extends T> values) {
		return new IterablePublisher<>(values);
	}

	@SafeVarargs
	public static <T> Publisher<T> just(T... values) {
		return from(Arrays.asList(values));
	}

	public static <T> Publisher<T> empty() {
		return from(Collections.<T>emptyList());
	}

	public static <T> Publisher<T> error(Throwable error) {
		return Exceptions.publisher(error);
	}
}
