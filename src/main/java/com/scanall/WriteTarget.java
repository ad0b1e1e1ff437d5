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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * An addressable slot into which a {@link RowCursor} writes exactly one column value of the current row.
 * <p>
 * Targets are declared explicitly by record authors, in result column order, and are never inferred from field names
 * or schema metadata:
 * <pre>{@code  public class Label implements SingleRecordBinder {
 *   private Integer id;
 *   private String name;
 *
 *   @Override
 *   public List<WriteTarget<?>> targets() {
 *     return List.of(
 *       WriteTarget.nonNull(Integer.class, value -> this.id = value),
 *       WriteTarget.of(String.class, value -> this.name = value)
 *     );
 *   }
 * }}</pre>
 * <p>
 * How the raw column value is converted to {@link #getType()} is up to the cursor performing the scan.
 *
 * @param <T> the Java type this slot accepts
 * @since 1.0.0
 */
@NotThreadSafe
public interface WriteTarget<T> {
	/**
	 * The type the scanning cursor should convert the column value to before calling {@link #write(Object)}.
	 * <p>
	 * {@code Object.class} means "whatever the cursor natively produces".
	 *
	 * @return the type accepted by this slot
	 */
	@NonNull
	Class<T> getType();

	/**
	 * Can this slot hold SQL {@code NULL}?
	 * <p>
	 * Cursors must fail the scan rather than call {@link #write(Object)} with {@code null} when this is {@code false}.
	 *
	 * @return {@code true} if {@code null} may be written to this slot
	 */
	@NonNull
	Boolean isNullable();

	/**
	 * Stores a column value into the owning record.
	 *
	 * @param value the converted column value, or {@code null} for SQL {@code NULL}
	 */
	void write(@Nullable T value);

	/**
	 * Creates a slot of the given type which accepts SQL {@code NULL}.
	 *
	 * @param type   the type the column value should be converted to
	 * @param writer stores the value into the owning record
	 * @param <T>    the slot type
	 * @return a nullable slot
	 */
	@NonNull
	static <T> WriteTarget<T> of(@NonNull Class<T> type,
															 @NonNull Consumer<@Nullable T> writer) {
		requireNonNull(type);
		requireNonNull(writer);

		return new DefaultWriteTarget<>(type, true, writer);
	}

	/**
	 * Creates a slot of the given type which rejects SQL {@code NULL}, e.g. for fields that back a primitive.
	 *
	 * @param type   the type the column value should be converted to
	 * @param writer stores the value into the owning record
	 * @param <T>    the slot type
	 * @return a non-nullable slot
	 */
	@NonNull
	static <T> WriteTarget<T> nonNull(@NonNull Class<T> type,
																		@NonNull Consumer<T> writer) {
		requireNonNull(type);
		requireNonNull(writer);

		return new DefaultWriteTarget<>(type, false, writer);
	}
}
