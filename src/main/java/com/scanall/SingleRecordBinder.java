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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;

/**
 * Contract for an object into which exactly one result row can be scanned.
 * <p>
 * Usually implemented by the record type itself. Instances are handed out once per row by
 * {@link RecordSetAccumulator#newElement()} and discarded right after the row is scanned.
 *
 * @since 1.0.0
 */
@NotThreadSafe
@FunctionalInterface
public interface SingleRecordBinder {
	/**
	 * Provides the slots the current row's columns are written into, positionally.
	 * <p>
	 * The list must have one entry per result column, in the query's column order. Arity or type problems are not
	 * detected here; they are reported by the {@link RowCursor} as a {@link RowScanException}.
	 *
	 * @return the ordered write targets for this record
	 */
	@NonNull
	List<@NonNull WriteTarget<?>> targets();
}
