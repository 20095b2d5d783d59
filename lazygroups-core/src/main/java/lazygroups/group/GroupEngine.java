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
package lazygroups.group;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import javax.annotation.concurrent.NotThreadSafe;

import lazygroups.core.error.GroupingExceptions;
import lazygroups.core.support.Assert;
import lazygroups.fn.KeyFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single pass over a source iterator shared by all the groups of one container.
 * <p>
 * Groups are numbered in discovery order. The engine only ever looks one element ahead of the group at the discovery
 * frontier ({@code top}) : as long as groups are consumed in order that group is served straight from the source and
 * nothing is buffered. When the next group is discovered before the frontier group is drained, the rest of the
 * frontier group is pulled into a buffer slot, unless its handle was already closed. Slots are indexed from
 * {@code bufbot}, slots below {@code bot} are drained and get released in bulk once they make up a large enough share
 * of the buffer.
 * <p>
 * Every call is an exclusive section : a call entering while another is running (for instance from a key function
 * that reads a group) fails with {@link GroupingExceptions.ConcurrentAccess}.
 *
 * @param <K> the key type
 * @param <T> the element type
 * @since 1.0
 */
@NotThreadSafe
final class GroupEngine<K, T> {

	private static final Logger log = LoggerFactory.getLogger(GroupEngine.class);

	/**
	 * Returned by {@link #step(long)} when the requesting group has no further element.
	 */
	static final Object NONE = new Object();

	private final Iterator<? extends T>               source;
	private final KeyFunction<? super T, ? extends K> keyFunction;
	private final int                                 compactionDivisor;

	private final ArrayList<GroupBuffer<T>> buffer = new ArrayList<>();

	private boolean done;

	private K       currentKey;
	private boolean hasCurrentKey;
	private T       currentElement;
	private boolean hasCurrentElement;

	private long top;
	private long bot;
	private long bufbot;
	private long droppedGroup = -1L;

	private volatile int running;
	@SuppressWarnings("rawtypes")
	private static final AtomicIntegerFieldUpdater<GroupEngine> RUNNING =
			AtomicIntegerFieldUpdater.newUpdater(GroupEngine.class, "running");

	GroupEngine(Iterator<? extends T> source, KeyFunction<? super T, ? extends K> keyFunction, int compactionDivisor) {
		Assert.notNull(source, "Source iterator cannot be null.");
		Assert.notNull(keyFunction, "Key function cannot be null.");
		this.source = source;
		this.keyFunction = keyFunction;
		this.compactionDivisor = Assert.positive(compactionDivisor, "Compaction divisor");
	}

	/**
	 * Produce the next element of group {@code client}.
	 *
	 * @param client index of the group asking for an element
	 * @return the element, or {@link #NONE} if the group has no further element
	 */
	Object step(long client) {
		enter();
		try {
			if (client < bot) {
				return NONE;
			}
			else if (client < top || (client == top && buffer.size() > top - bufbot)) {
				return lookupBuffer(client);
			}
			else if (done) {
				return NONE;
			}
			else if (client == top) {
				return stepCurrent();
			}
			else if (client == top + 1) {
				return stepBuffering(client);
			}
			throw GroupingExceptions.groupOutOfRange(client, top);
		}
		finally {
			exit();
		}
	}

	/**
	 * Read the key of the group whose first element was just produced. One more element is pulled to learn whether
	 * that group already ended.
	 *
	 * @param client index of the group just opened
	 * @return the group key
	 */
	K groupKey(long client) {
		enter();
		try {
			if (done || client != top || !hasCurrentKey || hasCurrentElement) {
				throw GroupingExceptions.keyUnavailable(client, top);
			}
			K oldKey = currentKey;
			currentKey = null;
			hasCurrentKey = false;

			Object next = nextElement();
			if (next != NONE) {
				@SuppressWarnings("unchecked")
				T element = (T) next;
				K key = keyFunction.apply(element);
				if (!Objects.equals(oldKey, key)) {
					top++;
				}
				setCurrentKey(key);
				setCurrentElement(element);
			}
			return oldKey;
		}
		finally {
			exit();
		}
	}

	/**
	 * Record that the handle of group {@code client} was closed. Elements already buffered for it are released, and if
	 * it is the frontier group its remaining elements will be skipped instead of buffered.
	 *
	 * @param client index of the closed group
	 */
	void dropGroup(long client) {
		enter();
		try {
			// only the frontier group can still avoid buffering, the highest index is enough
			if (client > droppedGroup) {
				droppedGroup = client;
			}
			if (client < bot || (client >= top && buffer.size() <= top - bufbot)) {
				return;
			}
			int slot = (int) (client - bufbot);
			if (slot < buffer.size()) {
				GroupBuffer<T> group = buffer.get(slot);
				if (!group.isEmpty() && log.isTraceEnabled()) {
					log.trace("Releasing {} buffered elements of closed group {}", group.remaining(), client);
				}
				group.clear();
			}
			if (client == bot) {
				advanceBottom();
			}
		}
		finally {
			exit();
		}
	}

	/**
	 * @return the number of source elements currently held in buffer slots
	 */
	long pending() {
		long pending = 0L;
		for (GroupBuffer<T> group : buffer) {
			pending += group.remaining();
		}
		return pending;
	}

	int bufferSlots() {
		return buffer.size();
	}

	long top() {
		return top;
	}

	long bot() {
		return bot;
	}

	long bufbot() {
		return bufbot;
	}

	boolean isDone() {
		return done;
	}

	private Object lookupBuffer(long client) {
		int slot = (int) (client - bufbot);
		Object element = slot < buffer.size() ? buffer.get(slot).poll() : NONE;
		if (element == NONE && client == bot) {
			advanceBottom();
		}
		return element;
	}

	/**
	 * Move {@code bot} past the drained group at {@code bot} and any drained slot after it, then release the leading
	 * drained slots once they make up {@code 1/compactionDivisor} of the buffer.
	 */
	private void advanceBottom() {
		bot++;
		while (bot - bufbot < buffer.size() && buffer.get((int) (bot - bufbot)).isEmpty()) {
			bot++;
		}

		long cleared = bot - bufbot;
		if (cleared > 0 && cleared >= buffer.size() / compactionDivisor) {
			int released = (int) Math.min(cleared, buffer.size());
			assert allDrained(released);
			buffer.subList(0, released).clear();
			if (log.isDebugEnabled()) {
				log.debug("Released {} drained group slots, buffer now spans groups {}..{}",
						released, bot, bot + buffer.size());
			}
			bufbot = bot;
		}
	}

	private boolean allDrained(int slots) {
		for (int i = 0; i < slots; i++) {
			if (!buffer.get(i).isEmpty()) {
				return false;
			}
		}
		return true;
	}

	private Object nextElement() {
		assert !done;
		if (source.hasNext()) {
			return source.next();
		}
		done = true;
		return NONE;
	}

	private Object stepCurrent() {
		if (hasCurrentElement) {
			return takeCurrentElement();
		}
		Object next = nextElement();
		if (next == NONE) {
			return NONE;
		}
		@SuppressWarnings("unchecked")
		T element = (T) next;
		K key = keyFunction.apply(element);
		if (hasCurrentKey && !Objects.equals(currentKey, key)) {
			setCurrentKey(key);
			setCurrentElement(element);
			top++;
			return NONE;
		}
		setCurrentKey(key);
		return element;
	}

	/**
	 * Walk the rest of the frontier group up to the first element of group {@code client == top + 1}, keeping the
	 * walked elements in a new buffer slot unless the frontier group was closed.
	 */
	private Object stepBuffering(long client) {
		assert top + 1 == client;
		boolean keep = top != droppedGroup;
		GroupBuffer<T> group = keep ? new GroupBuffer<T>() : null;

		if (hasCurrentElement) {
			T element = takeCurrentElement();
			if (keep) {
				group.add(element);
			}
		}

		Object first = NONE;
		long walked = 0L;
		Object next;
		while ((next = nextElement()) != NONE) {
			@SuppressWarnings("unchecked")
			T element = (T) next;
			K key = keyFunction.apply(element);
			if (hasCurrentKey && !Objects.equals(currentKey, key)) {
				setCurrentKey(key);
				first = element;
				break;
			}
			setCurrentKey(key);
			walked++;
			if (keep) {
				group.add(element);
			}
		}

		if (keep) {
			if (log.isTraceEnabled()) {
				log.trace("Buffered {} elements of group {} to reach group {}", group.remaining(), top, client);
			}
			pushNextGroup(group);
		}
		else if (log.isTraceEnabled()) {
			log.trace("Skipped {} elements of closed group {} to reach group {}", walked, top, client);
		}

		if (first != NONE) {
			top++;
		}
		return first;
	}

	private void pushNextGroup(GroupBuffer<T> group) {
		// fill the slots between the buffer end and the frontier group
		while (top - bufbot > buffer.size()) {
			if (buffer.isEmpty()) {
				bufbot++;
				bot++;
			}
			else {
				buffer.add(GroupBuffer.<T>empty());
			}
		}
		buffer.add(group);
		assert top + 1 - bufbot == buffer.size();
	}

	private void setCurrentKey(K key) {
		currentKey = key;
		hasCurrentKey = true;
	}

	private void setCurrentElement(T element) {
		currentElement = element;
		hasCurrentElement = true;
	}

	private T takeCurrentElement() {
		T element = currentElement;
		currentElement = null;
		hasCurrentElement = false;
		return element;
	}

	private void enter() {
		if (!RUNNING.compareAndSet(this, 0, 1)) {
			throw GroupingExceptions.concurrentAccess();
		}
	}

	private void exit() {
		running = 0;
	}

	@Override
	public String toString() {
		return "GroupEngine{" +
				"top=" + top +
				", bot=" + bot +
				", bufbot=" + bufbot +
				", slots=" + buffer.size() +
				", droppedGroup=" + droppedGroup +
				", done=" + done +
				'}';
	}
}
