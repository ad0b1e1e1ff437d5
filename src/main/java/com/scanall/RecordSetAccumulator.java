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
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Contract for a caller-owned collection into which any number of result rows can be scanned.
 * <p>
 * Implement it directly on your collection type:
 * <pre>{@code  public class Labels implements RecordSetAccumulator {
 *   private final List<Label> labels = new ArrayList<>();
 *
 *   @Override
 *   public SingleRecordBinder newElement() {
 *     Label label = new Label();
 *     labels.add(label);
 *     return label;
 *   }
 * }}</pre> Or wrap an existing {@link List} via {@link #forList(List, Supplier, Function)}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
@FunctionalInterface
public interface RecordSetAccumulator {
	/**
	 * Called once per result row: creates a new record, appends it to the underlying collection and returns a binder
	 * scoped to that record.
	 * <p>
	 * Must never hand out a previously returned binder.
	 *
	 * @return a binder for the freshly appended record
	 */
	@NonNull
	SingleRecordBinder newElement();

	/**
	 * Acquires an accumulator that appends to the given {@code records} list.
	 *
	 * @param records        the caller-owned list to append to
	 * @param recordFactory  creates an empty record for each row
	 * @param binderFactory  provides the write targets for a record
	 * @param <T>            record type
	 * @return an accumulator backed by {@code records}
	 */
	@NonNull
	static <T> RecordSetAccumulator forList(@NonNull List<T> records,
																					@NonNull Supplier<? extends T> recordFactory,
																					@NonNull Function<? super T, ? extends SingleRecordBinder> binderFactory) {
		requireNonNull(records);
		requireNonNull(recordFactory);
		requireNonNull(binderFactory);

		return () -> {
			T record = requireNonNull(recordFactory.get(), "Record factory returned null");
			records.add(record);
			return binderFactory.apply(record);
		};
	}
}
