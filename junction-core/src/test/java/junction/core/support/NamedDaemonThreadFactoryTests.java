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

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class NamedDaemonThreadFactoryTests {

	@Test
	public void threadsAreNumberedDaemons() {
		NamedDaemonThreadFactory factory = new NamedDaemonThreadFactory("merge");

		Thread first = factory.newThread(() -> { });
		Thread second = factory.newThread(() -> { });

		assertThat(first.getName(), is("merge-1"));
		assertThat(second.getName(), is("merge-2"));
		assertThat(first.isDaemon(), is(true));
		assertThat(first.getUncaughtExceptionHandler(), notNullValue());
	}

	@Test
	public void forkJoinWorkersShareTheNumbering() {
		NamedDaemonThreadFactory factory = new NamedDaemonThreadFactory("merge");
		ForkJoinPool pool = new ForkJoinPool(1);
		try {
			factory.newThread(() -> { });
			ForkJoinWorkerThread worker = factory.newThread(pool);

			assertThat(worker.getName(), is("merge-2"));
			assertThat(worker.isDaemon(), is(true));
		}
		finally {
			pool.shutdown();
		}
	}
}
