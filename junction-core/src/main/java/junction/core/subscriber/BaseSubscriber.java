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

import junction.core.error.Exceptions;
import junction.core.error.SpecificationExceptions;
import junction.core.support.BackpressureUtils;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Base of the subscribers a merge attaches to its sources. Rejects a null {@link Subscription} or error and
 * rethrows fatal errors before a subclass posts the signal to its merge.
 *
 * @param <T> the received value type
 * @since 1.0
 */
public abstract class BaseSubscriber<T> implements Subscriber<T> {

	@Override
	public void onSubscribe(Subscription s) {
		BackpressureUtils.checkSubscription(null, s);
	}

	@Override
	public void onError(Throwable t) {
		if (t == null) {
			throw SpecificationExceptions.spec_2_13_exception();
		}
		Exceptions.throwIfFatal(t);
	}
}
