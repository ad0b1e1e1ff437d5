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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Contract for an already-prepared query that can be run against bind arguments.
 * <p>
 * Preparing, caching and closing the underlying statement, as well as timeouts and cancellation, are the
 * implementation's business. See {@link PreparedStatementExecutor} for the JDBC implementation.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface StatementExecutor {
	/**
	 * Runs the query with the given bind arguments.
	 *
	 * @param parameters positional bind arguments, passed through as-is
	 * @return a cursor over the result rows, which the caller must close
	 * @throws StatementExecutionException if the query could not be started
	 */
	@NonNull
	RowCursor execute(@NonNull List<@Nullable Object> parameters);
}
