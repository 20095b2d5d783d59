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
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Cursor over the elements of one group. The first element is handed over when the group is opened, the others are
 * pulled from the shared {@link GroupEngine} on demand.
 * <p>
 * Closing the cursor tells the engine the group is no longer read : its buffered elements are released and, if no
 * later group was discovered yet, its remaining elements are skipped instead of buffered. The cursor closes itself
 * once exhausted.
 *
 * @param <T> the element type
 * @since 1.0
 */
public abstract class GroupCursor<T> implements Iterator<T>, AutoCloseable {

	final GroupEngine<?, T> engine;
	final long              index;

	private Object  next;
	private boolean closed;

	GroupCursor(GroupEngine<?, T> engine, long index, T first) {
		this.engine = engine;
		this.index = index;
		this.next = first;
	}

	/**
	 * @return the discovery index of this group, starting at 0
	 */
	public final long index() {
		return index;
	}

	@Override
	public final boolean hasNext() {
		if (next != GroupEngine.NONE) {
			return true;
		}
		if (closed) {
			return false;
		}
		Object element = engine.step(index);
		if (element == GroupEngine.NONE) {
			close();
			return false;
		}
		next = element;
		return true;
	}

	@Override
	@SuppressWarnings("unchecked")
	public final T next() {
		if (!hasNext()) {
			throw new NoSuchElementException("Group " + index + " has no more elements");
		}
		T element = (T) next;
		next = GroupEngine.NONE;
		return element;
	}

	/**
	 * Drain the remaining elements of this group and close it.
	 *
	 * @return the remaining elements in source order
	 */
	public final List<T> toList() {
		List<T> elements = new ArrayList<>();
		try {
			while (hasNext()) {
				elements.add(next());
			}
		}
		finally {
			close();
		}
		return elements;
	}

	/**
	 * Stop reading this group. Idempotent.
	 */
	@Override
	public final void close() {
		if (!closed) {
			engine.dropGroup(index);
			closed = true;
			next = GroupEngine.NONE;
		}
	}

	public final boolean isClosed() {
		return closed;
	}
}
