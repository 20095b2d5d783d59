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
package lazygroups.rx.stream;

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import lazygroups.core.support.Assert;
import lazygroups.rx.subscription.EmptySubscription;
import lazygroups.rx.support.BackpressureUtils;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish the elements of an {@link Iterator} to a single {@link Subscriber}.
 * <p>
 * Elements are pulled on the thread calling {@link Subscription#request(long)}, within that call. Requests issued from
 * {@code onNext} only add demand to the running emission loop. Cancelling stops the emission and closes the iterator
 * when it is {@link AutoCloseable}, which for a group handle releases its buffered elements.
 *
 * @param <T> the element type
 * @since 1.0
 */
public final class IteratorPublisher<T> implements Publisher<T> {

	private static final Logger log = LoggerFactory.getLogger(IteratorPublisher.class);

	private final Iterator<? extends T> iterator;

	private volatile int subscribed;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<IteratorPublisher> SUBSCRIBED =
			AtomicIntegerFieldUpdater.newUpdater(IteratorPublisher.class, "subscribed");

	public IteratorPublisher(Iterator<? extends T> iterator) {
		Assert.notNull(iterator, "Iterator cannot be null.");
		this.iterator = iterator;
	}

	@Override
	public void subscribe(Subscriber<? super T> subscriber) {
		if (subscriber == null) {
			throw BackpressureUtils.nullElement();
		}
		if (!SUBSCRIBED.compareAndSet(this, 0, 1)) {
			EmptySubscription.error(subscriber,
					new IllegalStateException("IteratorPublisher allows only a single Subscriber"));
			return;
		}
		subscriber.onSubscribe(new IteratorSubscription<T>(subscriber, iterator));
	}

	@Override
	public String toString() {
		return "IteratorPublisher{iterator=" + iterator + '}';
	}

	static final class IteratorSubscription<T> implements Subscription {

		private final Subscriber<? super T>  subscriber;
		private final Iterator<? extends T>  iterator;

		private volatile long requested;
		@SuppressWarnings("rawtypes")
		private static final AtomicLongFieldUpdater<IteratorSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(IteratorSubscription.class, "requested");

		private volatile boolean cancelled;
		private volatile boolean terminated;

		IteratorSubscription(Subscriber<? super T> subscriber, Iterator<? extends T> iterator) {
			this.subscriber = subscriber;
			this.iterator = iterator;
		}

		@Override
		public void request(long n) {
			if (n <= 0L) {
				if (!terminated && !cancelled) {
					terminated = true;
					closeIterator();
					subscriber.onError(BackpressureUtils.nonPositiveRequest(n));
				}
				return;
			}
			if (BackpressureUtils.getAndAdd(REQUESTED, this, n) == 0L) {
				if (n == Long.MAX_VALUE) {
					drainUnbounded();
				}
				else {
					drain(n);
				}
			}
		}

		@Override
		public void cancel() {
			if (cancelled) {
				return;
			}
			cancelled = true;
			if (requested == 0L && !terminated) {
				if (log.isDebugEnabled()) {
					log.debug("Cancelled {}", iterator);
				}
				closeIterator();
			}
		}

		private void drainUnbounded() {
			for (; ; ) {
				if (checkCancelled()) {
					return;
				}
				if (!emitNext()) {
					return;
				}
			}
		}

		private void drain(long n) {
			long emitted = 0L;
			long r = n;
			for (; ; ) {
				while (emitted != r) {
					if (checkCancelled()) {
						return;
					}
					if (!emitNext()) {
						return;
					}
					emitted++;
				}
				if (checkCancelled()) {
					return;
				}

				r = requested;
				if (r == Long.MAX_VALUE) {
					drainUnbounded();
					return;
				}
				if (r == emitted) {
					r = REQUESTED.addAndGet(this, -emitted);
					if (r == 0L) {
						return;
					}
					emitted = 0L;
				}
			}
		}

		/**
		 * @return true if an element was signalled, false once terminated
		 */
		private boolean emitNext() {
			T element;
			try {
				if (!iterator.hasNext()) {
					terminated = true;
					subscriber.onComplete();
					return false;
				}
				element = iterator.next();
			}
			catch (RuntimeException e) {
				terminated = true;
				closeIterator();
				subscriber.onError(e);
				return false;
			}
			if (element == null) {
				terminated = true;
				closeIterator();
				subscriber.onError(BackpressureUtils.nullElement());
				return false;
			}
			subscriber.onNext(element);
			return true;
		}

		private boolean checkCancelled() {
			if (cancelled) {
				if (log.isDebugEnabled()) {
					log.debug("Cancelled {}", iterator);
				}
				terminated = true;
				closeIterator();
				return true;
			}
			return terminated;
		}

		private void closeIterator() {
			if (iterator instanceof AutoCloseable) {
				try {
					((AutoCloseable) iterator).close();
				}
				catch (Exception e) {
					log.debug("Failed to close {}", iterator, e);
				}
			}
		}
	}
}
