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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator over the groups of a {@link GroupByLazy}. {@link #hasNext()} opens the next group : it takes a fresh index
 * from the container, pulls that group's first element and reads its key.
 *
 * @param <K> the key type
 * @param <T> the element type
 * @since 1.0
 */
public final class Groups<K, T> implements Iterator<Group<K, T>> {

	private final GroupByLazy<K, T> parent;

	private Group<K, T> opened;
	private boolean     finished;

	Groups(GroupByLazy<K, T> parent) {
		this.parent = parent;
	}

	@Override
	public boolean hasNext() {
		if (opened != null) {
			return true;
		}
		if (finished) {
			return false;
		}
		GroupEngine<K, T> engine = parent.engine;
		long index = parent.nextIndex();
		Object first = engine.step(index);
		if (first == GroupEngine.NONE) {
			finished = true;
			return false;
		}
		K key = engine.groupKey(index);
		@SuppressWarnings("unchecked")
		T element = (T) first;
		opened = new Group<>(engine, index, key, element);
		return true;
	}

	@Override
	public Group<K, T> next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more groups");
		}
		Group<K, T> group = opened;
		opened = null;
		return group;
	}
}
