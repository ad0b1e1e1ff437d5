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

/**
 * Scanall runs an already-prepared query and scans every result row into caller-owned records, with column bindings
 * spelled out by each record type instead of discovered through reflection.
 *
 * <pre>
 * public class Label implements SingleRecordBinder {
 *   Integer id;
 *   String name;
 *
 *   &#64;Override
 *   public List&lt;WriteTarget&lt;?&gt;&gt; targets() {
 *     return List.of(
 *       WriteTarget.nonNull(Integer.class, value -&gt; this.id = value),
 *       WriteTarget.of(String.class, value -&gt; this.name = value));
 *   }
 * }
 *
 * List&lt;Label&gt; labels = new ArrayList&lt;&gt;();
 * RowMaterializer rowMaterializer = RowMaterializer.withDefaultConfiguration();
 *
 * try (PreparedStatement preparedStatement = connection.prepareStatement("SELECT id, name FROM label WHERE owner_id = ?")) {
 *   rowMaterializer.materializeAll(PreparedStatementExecutor.forPreparedStatement(preparedStatement),
 *     RecordSetAccumulator.forList(labels, Label::new, label -&gt; label), ownerId);
 * }</pre>
 *
 * @since 1.0.0
 */
package com.scanall;
