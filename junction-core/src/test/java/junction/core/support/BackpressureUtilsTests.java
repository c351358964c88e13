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
package junction.core.support;

import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.junit.Test;
import org.reactivestreams.Subscription;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class BackpressureUtilsTests {

	volatile long requested;
	static final AtomicLongFieldUpdater<BackpressureUtilsTests> REQUESTED =
	  AtomicLongFieldUpdater.newUpdater(BackpressureUtilsTests.class, "requested");

	@Test
	public void additionIsCappedToLongMax() {
		assertThat(BackpressureUtils.addOrLongMax(1L, 2L), is(3L));
		assertThat(BackpressureUtils.addOrLongMax(Long.MAX_VALUE - 1, 5L), is(Long.MAX_VALUE));
	}

	@Test
	public void getAndAddKeepsUnboundedDemand() {
		requested = 0L;
		assertThat(BackpressureUtils.getAndAdd(REQUESTED, this, 10L), is(0L));
		assertThat(BackpressureUtils.getAndAdd(REQUESTED, this, Long.MAX_VALUE), is(10L));
		assertThat(requested, is(Long.MAX_VALUE));
		assertThat(BackpressureUtils.getAndAdd(REQUESTED, this, 1L), is(Long.MAX_VALUE));
		assertThat(requested, is(Long.MAX_VALUE));
	}

	@Test(expected = NullPointerException.class)
	public void nullSubscriptionIsRejected() {
		BackpressureUtils.checkSubscription(null, null);
	}

	@Test
	public void secondSubscriptionIsCancelled() {
		final boolean[] cancelled = new boolean[1];
		Subscription second = new Subscription() {
			@Override
			public void request(long n) {
			}

			@Override
			public void cancel() {
				cancelled[0] = true;
			}
		};

		assertThat(BackpressureUtils.checkSubscription(EmptySubscription.INSTANCE, second), is(false));
		assertThat(cancelled[0], is(true));
		assertThat(BackpressureUtils.checkSubscription(null, second), is(true));
	}
}
