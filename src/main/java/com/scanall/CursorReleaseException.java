/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.scanall;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown by {@link RowCursor#close()} when the cursor's underlying resources could not be released.
 * <p>
 * If materialization had already failed, this is attached to that failure as a suppressed exception instead of being
 * thrown.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class CursorReleaseException extends DatabaseException {
	public CursorReleaseException(@Nullable String message) {
		super(message);
	}

	public CursorReleaseException(@Nullable Throwable cause) {
		super(cause);
	}

	public CursorReleaseException(@Nullable String message,
																@Nullable Throwable cause) {
		super(message, cause);
	}
}
