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
package lazygroups.rx;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Synchronous {@link Subscriber} recording every signal, with assertion helpers.
 */
public class RecordingSubscriber<T> implements Subscriber<T> {

	private final List<T> values = new ArrayList<>();

	private Subscription subscription;
	private Throwable    error;
	private int          completions;
	private Consumer<T>  onNextHook = value -> {
	};

	public static <T> RecordingSubscriber<T> create() {
		return new RecordingSubscriber<>();
	}

	public RecordingSubscriber<T> onNextDo(Consumer<T> hook) {
		this.onNextHook = hook;
		return this;
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (subscription != null) {
			throw new AssertionError("Subscription already set: " + subscription);
		}
		this.subscription = s;
	}

	@Override
	public void onNext(T t) {
		assertNotTerminated();
		values.add(t);
		onNextHook.accept(t);
	}

	@Override
	public void onError(Throwable t) {
		assertNotTerminated();
		this.error = t;
	}

	@Override
	public void onComplete() {
		assertNotTerminated();
		completions++;
	}

	public RecordingSubscriber<T> request(long n) {
		subscription().request(n);
		return this;
	}

	public RecordingSubscriber<T> requestUnlimited() {
		return request(Long.MAX_VALUE);
	}

	public RecordingSubscriber<T> cancel() {
		subscription().cancel();
		return this;
	}

	public List<T> values() {
		return values;
	}

	public Throwable error() {
		return error;
	}

	public boolean isCompleted() {
		return completions == 1;
	}

	public boolean isTerminated() {
		return error != null || completions != 0;
	}

	public boolean isSubscribed() {
		return subscription != null;
	}

	private Subscription subscription() {
		if (subscription == null) {
			throw new AssertionError("onSubscribe wasn't called");
		}
		return subscription;
	}

	private void assertNotTerminated() {
		if (isTerminated()) {
			throw new AssertionError("Signal received after termination, error: " + error);
		}
	}
}
