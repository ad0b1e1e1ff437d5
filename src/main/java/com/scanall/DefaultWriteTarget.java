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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private implementation of {@link WriteTarget}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
class DefaultWriteTarget<T> implements WriteTarget<T> {
	@NonNull
	private final Class<T> type;
	@NonNull
	private final Boolean nullable;
	@NonNull
	private final Consumer<T> writer;

	DefaultWriteTarget(@NonNull Class<T> type,
										 @NonNull Boolean nullable,
										 @NonNull Consumer<T> writer) {
		requireNonNull(type);
		requireNonNull(nullable);
		requireNonNull(writer);

		this.type = type;
		this.nullable = nullable;
		this.writer = writer;
	}

	@Override
	public void write(@Nullable T value) {
		if (value == null && !isNullable())
			throw new IllegalArgumentException(format("Slot of type %s does not accept null", getType().getName()));

		this.writer.accept(value);
	}

	@NonNull
	@Override
	public Class<T> getType() {
		return this.type;
	}

	@NonNull
	@Override
	public Boolean isNullable() {
		return this.nullable;
	}

	@Override
	public String toString() {
		return format("%s{type=%s, nullable=%s}", getClass().getSimpleName(), getType().getName(), isNullable());
	}
}
