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
package lazygroups.fn;

import lazygroups.core.support.Assert;

/**
 * Key producer for fixed size chunking. The element value is ignored : every call counts one more element and the key
 * moves to the next chunk number once {@code size} elements have been counted, producing the keys
 * {@code 0, 0, .., 1, 1, .., 2, ..} with each key repeated {@code size} times.
 *
 * @since 1.0
 */
public final class ChunkIndex implements KeyFunction<Object, Long> {

	private final int size;

	private int  index;
	private long key;

	public ChunkIndex(int size) {
		this.size = Assert.positive(size, "Chunk size");
	}

	@Override
	public Long apply(Object element) {
		if (index == size) {
			key++;
			index = 0;
		}
		index++;
		return key;
	}

	public int size() {
		return size;
	}

	@Override
	public String toString() {
		return "ChunkIndex{size=" + size + ", index=" + index + ", key=" + key + '}';
	}
}
