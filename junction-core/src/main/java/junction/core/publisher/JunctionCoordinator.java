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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import junction.core.error.Exceptions;
import junction.core.error.SpecificationExceptions;
import junction.core.support.BackpressureUtils;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The merge engine behind a single downstream subscription.
 * <p>
 * Sources, the source of sources and the downstream subscription never touch the merge state directly: they post
 * a {@link Signal} to a mailbox and call {@link #drain()}. The thread moving the work-in-progress counter from
 * zero runs the drain loop, processing signals one at a time until no work is left. All the fields below the
 * "drain loop only" marker are confined to that loop.
 * <p>
 * Read-ahead rules:
 * <ul>
 *     <li>every admitted source has at most one value requested or held</li>
 *     <li>a value is buffered if the buffer holds less values than there are active sources, and the source is
 *     then asked for its next value</li>
 *     <li>otherwise the source is held with its value, and released in ready order when downstream consumes</li>
 * </ul>
 *
 * @param <T> the merged value type
 * @since 1.0
 */
final class JunctionCoordinator<T> implements Subscription, MergeState {

	private static final Logger log = LoggerFactory.getLogger(JunctionCoordinator.class);

	final Subscriber<? super T>  actual;
	final Executor               executor;
	final int                    maxOpen;
	final AdmissionController<T> admission;

	final Queue<Signal> mailbox = new ConcurrentLinkedQueue<>();

	private volatile int wip;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<JunctionCoordinator> WIP =
	  AtomicIntegerFieldUpdater.newUpdater(JunctionCoordinator.class, "wip");

	private volatile long requested;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<JunctionCoordinator> REQUESTED =
	  AtomicLongFieldUpdater.newUpdater(JunctionCoordinator.class, "requested");

	volatile JunctionState   state = JunctionState.RUNNING;
	volatile JunctionOutcome outcome;
	volatile boolean         downstreamCancelled;

	private volatile int activeCount;
	private volatile int pendingCount;
	private volatile int bufferedCount;

	// drain loop only
	final Map<Long, SourceHandle<T>> active = new LinkedHashMap<>();
	final ArrayDeque<SourceHandle<T>> held  = new ArrayDeque<>();
	final ReadAheadBuffer<T>         buffer = new ReadAheadBuffer<>();

	long      nextId;
	int       awaitingAcks;
	Throwable failure;

	JunctionCoordinator(Subscriber<? super T> actual, int maxOpen, Executor executor) {
		this.actual = actual;
		this.executor = executor;
		this.maxOpen = maxOpen > 0 ? maxOpen : 0;
		this.admission = new AdmissionController<>(this, this.maxOpen);
	}

	// Downstream subscription

	@Override
	public void request(long n) {
		if (n <= 0L) {
			post(Signal.downstreamFailed(SpecificationExceptions.spec_3_09_exception(n)));
			return;
		}
		BackpressureUtils.getAndAdd(REQUESTED, this, n);
		drain();
	}

	@Override
	public void cancel() {
		downstreamCancelled = true;
		post(Signal.DOWNSTREAM_CANCEL);
	}

	// Mailbox

	void sourcesSubscribed() {
		post(Signal.SOURCES_SUBSCRIBED);
	}

	void sourceArrived(Publisher<? extends T> source) {
		post(new Signal(Signal.Type.SOURCE_ARRIVED, null, source, null));
	}

	void sourcesCompleted() {
		post(Signal.SOURCES_COMPLETE);
	}

	void sourcesFailed(Throwable error) {
		post(new Signal(Signal.Type.SOURCES_FAILED, null, null, error));
	}

	void sourceSubscribed(SourceHandle<T> source) {
		post(new Signal(Signal.Type.SOURCE_SUBSCRIBED, source, null, null));
	}

	void valueReady(SourceHandle<T> source, T value) {
		post(new Signal(Signal.Type.VALUE_READY, source, value, null));
	}

	void sourceCompleted(SourceHandle<T> source) {
		post(new Signal(Signal.Type.SOURCE_COMPLETE, source, null, null));
	}

	void sourceFailed(SourceHandle<T> source, Throwable error) {
		post(new Signal(Signal.Type.SOURCE_FAILED, source, null, error));
	}

	/**
	 * @param source       the cancelled source, null for the source of sources
	 * @param cleanupError the error thrown by the cancellation, if any
	 */
	void cancelAcknowledged(SourceHandle<T> source, Throwable cleanupError) {
		post(new Signal(Signal.Type.CANCEL_ACK, source, null, cleanupError));
	}

	void post(Signal signal) {
		mailbox.offer(signal);
		drain();
	}

	void drain() {
		if (WIP.getAndIncrement(this) != 0) {
			return;
		}
		int missed = 1;
		for (; ; ) {
			drainLoop();
			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	void drainLoop() {
		Signal signal;
		while ((signal = mailbox.poll()) != null) {
			if (state == JunctionState.DONE) {
				log.trace("Dropping {} received after termination", signal);
				continue;
			}
			onSignal(signal);
		}

		if (state == JunctionState.RUNNING) {
			releaseHeld();
			emit();
		}
		if (state == JunctionState.RUNNING) {
			try {
				admission.requestNextIfAllowed();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				fail(t);
			}
		}
		tryTerminate();
		snapshot();
	}

	@SuppressWarnings("unchecked")
	void onSignal(Signal signal) {
		SourceHandle<T> source = (SourceHandle<T>) signal.source;
		switch (signal.type) {
			case SOURCES_SUBSCRIBED:
				admission.subscribed = true;
				break;
			case SOURCE_ARRIVED:
				onNewSource((Publisher<? extends T>) signal.value);
				break;
			case SOURCES_COMPLETE:
				onSourcesExhausted();
				break;
			case SOURCES_FAILED:
				onSourcesFailed(signal.error);
				break;
			case SOURCE_SUBSCRIBED:
				onSourceSubscribed(source);
				break;
			case VALUE_READY:
				onValueReady(source, (T) signal.value);
				break;
			case SOURCE_COMPLETE:
				onSourceClosed(source);
				break;
			case SOURCE_FAILED:
				onSourceFailed(source, signal.error);
				break;
			case CANCEL_ACK:
				onCancelAcknowledged(source, signal.error);
				break;
			case DOWNSTREAM_CANCEL:
				onDownstreamCancel();
				break;
			case DOWNSTREAM_FAILED:
				fail(signal.error);
				break;
		}
	}

	// Admission

	void onNewSource(Publisher<? extends T> source) {
		if (state != JunctionState.RUNNING) {
			log.trace("Ignoring source arrived while {}", state);
			return;
		}
		if (source == null) {
			fail(SpecificationExceptions.spec_2_13_exception());
			return;
		}
		admission.onNewSource(source);
		if (!admission.pending.isEmpty()) {
			log.debug("Source queued, {} active / maxOpen={}, {} pending",
					active.size(), maxOpen, admission.pending.size());
		}
	}

	/**
	 * Register a new active source and subscribe it on the executor. This is the only place where concurrent work
	 * is spawned.
	 */
	void admit(Publisher<? extends T> source) {
		final SourceHandle<T> handle = new SourceHandle<>(this, nextId++);
		active.put(handle.id, handle);
		if (log.isDebugEnabled()) {
			log.debug("Admitting source #{} ({} active, maxOpen={})", handle.id, active.size(), maxOpen);
		}
		try {
			executor.execute(() -> subscribeSource(source, handle));
		}
		catch (RejectedExecutionException ree) {
			handle.state = SourceHandle.ProducerState.FAILED;
			active.remove(handle.id);
			fail(ree);
		}
	}

	static <T> void subscribeSource(Publisher<? extends T> source, SourceHandle<T> handle) {
		try {
			source.subscribe(handle);
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			handle.parent.sourceFailed(handle, t);
		}
	}

	void onSourcesExhausted() {
		admission.exhausted = true;
		admission.outstanding = false;
		if (admission.ackPending) {
			acknowledge(null);
		}
		log.debug("Source of sources completed, {} active, {} pending", active.size(), admission.pending.size());
	}

	void onSourcesFailed(Throwable error) {
		admission.failed = true;
		if (admission.ackPending) {
			acknowledge(null);
		}
		fail(error);
	}

	/**
	 * Retire a terminated source and hand its slot to the next pending one.
	 */
	void retire(SourceHandle<T> handle) {
		active.remove(handle.id);
		if (log.isDebugEnabled()) {
			log.debug("Source #{} closed ({} active)", handle.id, active.size());
		}
		admission.onSlotFreed();
	}

	// Merge

	boolean isLive(SourceHandle<T> handle) {
		return handle != null && active.get(handle.id) == handle;
	}

	void onSourceSubscribed(SourceHandle<T> handle) {
		if (state == JunctionState.RUNNING && isLive(handle)) {
			requestFrom(handle);
		}
	}

	void onValueReady(SourceHandle<T> handle, T value) {
		if (state != JunctionState.RUNNING || !isLive(handle)) {
			log.trace("Dropping value from source #{}", handle.id);
			return;
		}
		if (handle.state != SourceHandle.ProducerState.REQUESTING) {
			handle.state = SourceHandle.ProducerState.FAILED;
			active.remove(handle.id);
			fail(SpecificationExceptions.spec_1_01_exception());
			return;
		}
		// older held values take free slots first
		releaseHeld();
		if (held.isEmpty() && buffer.offer(value, active.size())) {
			log.trace("Source #{} value buffered", handle.id);
			requestFrom(handle);
		}
		else {
			log.trace("Source #{} held, buffer saturated", handle.id);
			handle.hold(value);
			held.offer(handle);
		}
	}

	void onSourceClosed(SourceHandle<T> handle) {
		if (!isLive(handle)) {
			if (handle.ackPending) {
				acknowledge(handle);
			}
			return;
		}
		if (handle.state == SourceHandle.ProducerState.HAS_VALUE) {
			handle.completed = true;
			return;
		}
		handle.state = SourceHandle.ProducerState.CLOSED;
		retire(handle);
	}

	void onSourceFailed(SourceHandle<T> handle, Throwable error) {
		if (!isLive(handle)) {
			if (handle.ackPending) {
				acknowledge(handle);
			}
			log.debug("Discarding failure of inactive source #{}", handle.id, error);
			return;
		}
		handle.state = SourceHandle.ProducerState.FAILED;
		active.remove(handle.id);
		held.remove(handle);
		fail(error);
	}

	void requestFrom(SourceHandle<T> handle) {
		try {
			handle.request();
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			handle.state = SourceHandle.ProducerState.FAILED;
			active.remove(handle.id);
			fail(t);
		}
	}

	/**
	 * Move held values into the buffer in the order they became ready, while the buffer has room.
	 */
	void releaseHeld() {
		SourceHandle<T> handle;
		while (state == JunctionState.RUNNING && buffer.hasRoom(active.size()) && (handle = held.poll()) != null) {
			buffer.offer(handle.release(), active.size());
			if (handle.completed) {
				handle.state = SourceHandle.ProducerState.CLOSED;
				retire(handle);
			}
			else {
				requestFrom(handle);
			}
		}
	}

	void emit() {
		for (; ; ) {
			long r = requested;
			long e = 0L;

			while (e != r && state == JunctionState.RUNNING && !downstreamCancelled) {
				T value = buffer.poll();
				if (value == null) {
					break;
				}
				releaseHeld();
				snapshot();
				try {
					actual.onNext(value);
				}
				catch (Throwable t) {
					Exceptions.throwIfFatal(t);
					fail(t);
					return;
				}
				e++;
			}

			if (e == 0L) {
				return;
			}
			if (r != Long.MAX_VALUE) {
				REQUESTED.addAndGet(this, -e);
			}
		}
	}

	// Termination

	void fail(Throwable error) {
		if (state != JunctionState.RUNNING) {
			log.debug("Discarding failure observed while {}", state, error);
			return;
		}
		failure = error;
		log.debug("Merge failed, cancelling {} active sources", active.size(), error);
		close(JunctionState.SOURCE_CLOSING);
	}

	void onDownstreamCancel() {
		if (state == JunctionState.RUNNING) {
			log.debug("Downstream cancelled, cancelling {} active sources", active.size());
			close(JunctionState.DOWNSTREAM_CLOSING);
		}
	}

	/**
	 * Drop read-ahead values and queued sources, then cancel every live source and the source of sources.
	 */
	void close(JunctionState closingState) {
		state = closingState;
		int dropped = buffer.clear();
		held.clear();
		int queued = admission.clearPending();
		if (dropped != 0 || queued != 0) {
			log.debug("Discarding {} buffered values and {} queued sources", dropped, queued);
		}

		for (SourceHandle<T> handle : active.values()) {
			if (handle.isTerminal()) {
				continue;
			}
			boolean acknowledged;
			try {
				acknowledged = handle.cancel();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				cleanupFailed(handle, t);
				acknowledged = true;
			}
			if (!acknowledged) {
				handle.ackPending = true;
				awaitingAcks++;
			}
		}
		active.clear();

		if (!admission.isTerminated()) {
			boolean acknowledged;
			try {
				acknowledged = admission.cancel();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				cleanupFailed(null, t);
				acknowledged = true;
			}
			if (!acknowledged) {
				admission.ackPending = true;
				awaitingAcks++;
			}
		}
	}

	void onCancelAcknowledged(SourceHandle<T> handle, Throwable cleanupError) {
		if (cleanupError != null) {
			cleanupFailed(handle, cleanupError);
		}
		if (handle == null ? admission.ackPending : handle.ackPending) {
			acknowledge(handle);
		}
	}

	void acknowledge(SourceHandle<T> handle) {
		if (handle == null) {
			admission.ackPending = false;
		}
		else {
			handle.ackPending = false;
		}
		awaitingAcks--;
		log.trace("Cancellation of {} acknowledged, {} left", handle == null ? "source of sources" : handle, awaitingAcks);
	}

	void cleanupFailed(SourceHandle<T> handle, Throwable error) {
		log.warn("Cancelling {} failed", handle == null ? "the source of sources" : "source #" + handle.id, error);
		Exceptions.addSuppressed(failure, error);
	}

	void tryTerminate() {
		JunctionState s = state;
		if (s.isClosing()) {
			if (awaitingAcks == 0) {
				done(s == JunctionState.SOURCE_CLOSING ? JunctionOutcome.failed(failure) : JunctionOutcome.KILLED);
			}
		}
		else if (s == JunctionState.RUNNING && admission.isDrained() && active.isEmpty() && buffer.isEmpty()) {
			done(JunctionOutcome.COMPLETED);
		}
	}

	void done(JunctionOutcome result) {
		outcome = result;
		state = JunctionState.DONE;
		log.debug("Merge terminated: {}", result);
		try {
			if (result.kind() == JunctionOutcome.Kind.COMPLETED) {
				actual.onComplete();
			}
			else if (result.isFailure() && !downstreamCancelled) {
				actual.onError(result.error());
			}
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			log.error("Downstream subscriber failed to handle terminal signal {}", result, t);
		}
	}

	void snapshot() {
		activeCount = active.size();
		pendingCount = admission.pending.size();
		bufferedCount = buffer.size();
	}

	// MergeState

	@Override
	public int activeCount() {
		return activeCount;
	}

	@Override
	public int pendingCount() {
		return pendingCount;
	}

	@Override
	public int bufferedCount() {
		return bufferedCount;
	}

	@Override
	public int maxOpen() {
		return maxOpen;
	}

	@Override
	public JunctionState state() {
		return state;
	}

	@Override
	public JunctionOutcome outcome() {
		return outcome;
	}

	@Override
	public String toString() {
		return "JunctionCoordinator{" +
				"state=" + state +
				", active=" + activeCount +
				", pending=" + pendingCount +
				", buffered=" + bufferedCount +
				", maxOpen=" + maxOpen +
				", requested=" + requested +
				'}';
	}

	/**
	 * An event posted to the coordinator mailbox.
	 */
	static final class Signal {

		enum Type {
			SOURCES_SUBSCRIBED,
			SOURCE_ARRIVED,
			SOURCES_COMPLETE,
			SOURCES_FAILED,
			SOURCE_SUBSCRIBED,
			VALUE_READY,
			SOURCE_COMPLETE,
			SOURCE_FAILED,
			CANCEL_ACK,
			DOWNSTREAM_CANCEL,
			DOWNSTREAM_FAILED
		}

		static final Signal SOURCES_SUBSCRIBED = new Signal(Type.SOURCES_SUBSCRIBED, null, null, null);
		static final Signal SOURCES_COMPLETE   = new Signal(Type.SOURCES_COMPLETE, null, null, null);
		static final Signal DOWNSTREAM_CANCEL  = new Signal(Type.DOWNSTREAM_CANCEL, null, null, null);

		static Signal downstreamFailed(Throwable error) {
			return new Signal(Type.DOWNSTREAM_FAILED, null, null, error);
		}

		final Type            type;
		final SourceHandle<?> source;
		final Object          value;
		final Throwable       error;

		Signal(Type type, SourceHandle<?> source, Object value, Throwable error) {
			this.type = type;
			this.source = source;
			this.value = value;
			this.error = error;
		}

		@Override
		public String toString() {
			return type + (source != null ? "#" + source.id : "");
		}
	}
}
