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
package lazygroups.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables read once from system properties.
 *
 * <ul>
 * <li>{@code lazygroups.buffer.compactionDivisor} : leading drained buffer slots are released once they make up at
 * least {@code 1/divisor} of the buffer. Defaults to {@code 2}.</li>
 * </ul>
 *
 * @since 1.0
 */
public final class Configuration {

	private static final Logger log = LoggerFactory.getLogger(Configuration.class);

	public static final String COMPACTION_DIVISOR_PROPERTY = "lazygroups.buffer.compactionDivisor";

	public static final int DEFAULT_COMPACTION_DIVISOR = 2;

	public static final int COMPACTION_DIVISOR =
			readPositiveInt(COMPACTION_DIVISOR_PROPERTY, DEFAULT_COMPACTION_DIVISOR);

	private Configuration() {
	}

	static int readPositiveInt(String property, int defaultValue) {
		String value = System.getProperty(property);
		if (value == null) {
			return defaultValue;
		}
		try {
			int parsed = Integer.parseInt(value.trim());
			if (parsed >= 1) {
				return parsed;
			}
		}
		catch (NumberFormatException nfe) {
			log.warn("Ignoring non numeric value '{}' for {}", value, property);
			return defaultValue;
		}
		log.warn("Ignoring value {} for {}, expecting a strictly positive integer", value, property);
		return defaultValue;
	}
}
