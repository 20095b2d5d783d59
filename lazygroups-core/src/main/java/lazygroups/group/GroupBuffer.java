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

/**
 * Elements of one group that were pulled from the source before the group owner asked for them. Polled elements are
 * released right away and the backing list is dropped once drained.
 *
 * @param <T> the element type
 */
final class GroupBuffer<T> {

	@SuppressWarnings("rawtypes")
	private static final GroupBuffer EMPTY = new GroupBuffer();

	@SuppressWarnings("unchecked")
	static <T> GroupBuffer<T> empty() {
		return (GroupBuffer<T>) EMPTY;
	}

	private ArrayList<T> elements;
	private int          head;

	void add(T element) {
		assert this != EMPTY;
		if (elements == null) {
			elements = new ArrayList<>();
		}
		elements.add(element);
	}

	/**
	 * @return the next buffered element or {@link GroupEngine#NONE}
	 */
	Object poll() {
		ArrayList<T> elements = this.elements;
		if (elements == null) {
			return GroupEngine.NONE;
		}
		T element = elements.set(head++, null);
		if (head == elements.size()) {
			clear();
		}
		return element;
	}

	int remaining() {
		return elements == null ? 0 : elements.size() - head;
	}

	boolean isEmpty() {
		return elements == null;
	}

	void clear() {
		elements = null;
		head = 0;
	}

	@Override
	public String toString() {
		return "GroupBuffer{remaining=" + remaining() + '}';
	}
}
