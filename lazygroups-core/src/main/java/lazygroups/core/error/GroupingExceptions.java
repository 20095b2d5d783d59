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
package lazygroups.core.error;

/**
 * Misuse of the grouping engine. All of these are programming errors : recovering from them would risk skipping or
 * duplicating source elements, so the engine refuses the call and leaves its state untouched.
 *
 * @since 1.0
 */
public final class GroupingExceptions {

	private GroupingExceptions() {
	}

	public static IllegalStateException concurrentAccess() {
		return new ConcurrentAccess();
	}

	public static IllegalStateException groupOutOfRange(long client, long top) {
		return new GroupOutOfRange(client, top);
	}

	public static IllegalStateException keyUnavailable(long client, long top) {
		return new KeyUnavailable(client, top);
	}

	/**
	 * A call entered the engine while another one was still running, either re-entrantly from a key function or from
	 * another thread.
	 */
	public static final class ConcurrentAccess extends IllegalStateException {

		private static final long serialVersionUID = 2204856732615427110L;

		public ConcurrentAccess() {
			super("Grouping engine is already in use : re-entrant or concurrent access is not supported");
		}
	}

	/**
	 * Groups are discovered one at a time, a client may only request the group right after the frontier.
	 */
	public static final class GroupOutOfRange extends IllegalStateException {

		private static final long serialVersionUID = -6312078460934457301L;

		public GroupOutOfRange(long client, long top) {
			super("Group " + client + " requested while the discovery frontier is at group " + top +
					" : only group " + (top + 1) + " can be discovered next");
		}
	}

	public static final class KeyUnavailable extends IllegalStateException {

		private static final long serialVersionUID = 5630118790731245286L;

		public KeyUnavailable(long client, long top) {
			super("No key available for group " + client + " (frontier at group " + top +
					") : a key can only be read right after the group first element was produced");
		}
	}
}
