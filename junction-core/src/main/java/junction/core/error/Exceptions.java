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
package junction.core.error;

import junction.core.support.EmptySubscription;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

/**
 * Static helpers to classify, combine and publish errors.
 * <p>
 * Original design from https://github.com/ReactiveX/RxJava/blob/1.x/src/main/java/rx/exceptions/Exceptions.java
 *
 * @since 1.0
 */
public final class Exceptions {

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error varieties. These
	 * varieties are as follows:
	 * <ul>
	 * <li>{@code StackOverflowError}</li>
	 * <li>{@code VirtualMachineError}</li>
	 * <li>{@code ThreadDeath}</li>
	 * <li>{@code LinkageError}</li>
	 * </ul>
	 *
	 * @param t the error to check
	 */
	@SuppressWarnings("deprecation")
	public static void throwIfFatal(Throwable t) {
		if (t instanceof StackOverflowError) {
			throw (StackOverflowError) t;
		} else if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		} else if (t instanceof ThreadDeath) {
			throw (ThreadDeath) t;
		} else if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	/**
	 * Attach a secondary error to a primary failure without ever replacing it.
	 *
	 * @param primary   the failure that terminates the sequence, may be null
	 * @param secondary the error raised while cleaning up
	 * @return true if the secondary error has been attached
	 */
	public static boolean addSuppressed(Throwable primary, Throwable secondary) {
		if (primary == null || secondary == null || primary == secondary) {
			return false;
		}
		for (Throwable t : primary.getSuppressed()) {
			if (t == secondary) {
				return false;
			}
		}
		primary.addSuppressed(secondary);
		return true;
	}

	/**
	 * Return a failed {@link Publisher} if the given error is not fatal
	 *
	 * @param error the error to signal to every subscriber
	 * @param <IN>  the type of the never emitted values
	 * @return a failed {@link Publisher}
	 */
	public static <IN> Publisher<IN> publisher(final Throwable error) {
		throwIfFatal(error);
		return new ErrorPublisher<>(error);
	}

	private static final class ErrorPublisher<IN> implements Publisher<IN> {

		private final Throwable error;

		ErrorPublisher(Throwable error) {
			this.error = error;
		}

		@Override
		public void subscribe(Subscriber<? super IN> s) {
			if (s == null) {
				throw SpecificationExceptions.spec_2_13_exception();
			}
			s.onSubscribe(EmptySubscription.INSTANCE);
			s.onError(error);
		}

		@Override
		public String toString() {
			return "{ error: \"" + error + "\" }";
		}
	}

	private Exceptions() {
	}
}
