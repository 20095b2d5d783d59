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
 * Iterator over the chunks of a {@link ChunksLazy}.
 *
 * @param <T> the element type
 * @since 1.0
 */
public final class Chunks<T> implements Iterator<Chunk<T>> {

	private final ChunksLazy<T> parent;

	private Chunk<T> opened;
	private boolean  finished;

	Chunks(ChunksLazy<T> parent) {
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
		long index = parent.nextIndex();
		Object first = parent.engine.step(index);
		if (first == GroupEngine.NONE) {
			finished = true;
			return false;
		}
		@SuppressWarnings("unchecked")
		T element = (T) first;
		opened = new Chunk<>(parent.engine, index, element);
		return true;
	}

	@Override
	public Chunk<T> next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more chunks");
		}
		Chunk<T> chunk = opened;
		opened = null;
		return chunk;
	}
}
