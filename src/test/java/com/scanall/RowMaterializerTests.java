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

import com.scanall.TestRecords.Label;
import com.scanall.TestRecords.Labels;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * @since 1.0.0
 */
public class RowMaterializerTests {
	@Test
	public void testAllRowsMaterializedInDeliveryOrder() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(
				List.of(3, "three"),
				List.of(1, "one"),
				List.of(2, "two")
		));
		Labels labels = new Labels();

		Long rowCount = RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, labels, 42, "owner");

		Assertions.assertEquals(3L, rowCount, "Wrong row count");
		Assertions.assertEquals(List.of(3, 1, 2), labels.getLabels().stream().map(Label::getId).collect(Collectors.toList()));
		Assertions.assertEquals(List.of("three", "one", "two"), labels.getLabels().stream().map(Label::getName).collect(Collectors.toList()));
		Assertions.assertEquals(List.of(42, "owner"), statementExecutor.getExecutedParameters(), "Parameters not passed through");
		Assertions.assertEquals(1, statementExecutor.getExecuteCalls());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls(), "Cursor should be closed exactly once");
	}

	@Test
	public void testOrderingPreservedForLargeResult() {
		List<List<Object>> rows = IntStream.rangeClosed(1, 500)
				.mapToObj(i -> List.<Object>of(i, "label-" + i))
				.collect(Collectors.toList());
		Labels labels = new Labels();

		RowMaterializer.withDefaultConfiguration().materializeAll(FakeStatementExecutor.withRows(rows), labels);

		Assertions.assertEquals(500, labels.getLabels().size());

		for (int i = 0; i < 500; ++i)
			Assertions.assertEquals(i + 1, labels.getLabels().get(i).getId(), "Row out of order");
	}

	@Test
	public void testEmptyResultLeavesAccumulatorUntouched() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of());
		Labels labels = new Labels();

		Long rowCount = RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, labels);

		Assertions.assertEquals(0L, rowCount);
		Assertions.assertEquals(0, labels.getNewElementCalls(), "No element should have been allocated");
		Assertions.assertTrue(labels.getLabels().isEmpty());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testExecutionFailurePropagatedWithoutCursor() {
		StatementExecutionException executionFailure = new StatementExecutionException("backing store unavailable");
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one")))
				.failExecution(executionFailure);
		Labels labels = new Labels();

		StatementExecutionException e = Assertions.assertThrows(StatementExecutionException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, labels));

		Assertions.assertSame(executionFailure, e, "Execution failure should propagate unchanged");
		Assertions.assertEquals(1, statementExecutor.getExecuteCalls());
		Assertions.assertEquals(0, labels.getNewElementCalls());
		Assertions.assertEquals(0, statementExecutor.getAdvanceCalls());
		Assertions.assertEquals(0, statementExecutor.getCloseCalls(), "No cursor was acquired, so none should be closed");
	}

	@Test
	public void testScanFailureStopsIterationAndKeepsPartialResults() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(
				List.of(1, "one"),
				List.of(2, "two"),
				List.of(3, "three")
		)).failScanAtRow(2);
		Labels labels = new Labels();

		RowScanException e = Assertions.assertThrows(RowScanException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, labels));

		Assertions.assertEquals(2L, e.getRowNumber());
		Assertions.assertEquals(2, labels.getLabels().size(), "Expected one populated and one allocated-but-empty record");
		Assertions.assertTrue(labels.getLabels().get(0).isPopulated());
		Assertions.assertEquals(1, labels.getLabels().get(0).getId());
		Assertions.assertFalse(labels.getLabels().get(1).isPopulated());
		Assertions.assertEquals(2, statementExecutor.getAdvanceCalls(), "Row 3 should never be fetched");
		Assertions.assertEquals(2, statementExecutor.getScanCalls());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testArityMismatchIsScanFailure() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one", "extra")));
		Labels labels = new Labels();

		RowScanException e = Assertions.assertThrows(RowScanException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, labels));

		Assertions.assertEquals("Expected 3 destination arguments in scan, not 2", e.getMessage());
		Assertions.assertEquals(1, labels.getLabels().size());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testTerminalErrorReportedAfterAllRowsScanned() {
		TerminalCursorException terminalFailure = new TerminalCursorException("connection reset mid-stream");
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(
				List.of(1, "one"),
				List.of(2, "two")
		)).failAfterLastRow(terminalFailure);
		Labels labels = new Labels();

		TerminalCursorException e = Assertions.assertThrows(TerminalCursorException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, labels));

		Assertions.assertSame(terminalFailure, e);
		Assertions.assertEquals(2, labels.getLabels().size());
		Assertions.assertTrue(labels.getLabels().stream().allMatch(Label::isPopulated), "Both rows should be fully populated");
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testReleaseFailureThrownWhenOnlyFailure() {
		CursorReleaseException releaseFailure = new CursorReleaseException("unable to close");
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one")))
				.failRelease(releaseFailure);
		Labels labels = new Labels();

		CursorReleaseException e = Assertions.assertThrows(CursorReleaseException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, labels));

		Assertions.assertSame(releaseFailure, e);
		Assertions.assertEquals(1, labels.getLabels().size());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testReleaseFailureDoesNotMaskScanFailure() {
		CursorReleaseException releaseFailure = new CursorReleaseException("unable to close");
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one")))
				.failScanAtRow(1)
				.failRelease(releaseFailure);

		RowScanException e = Assertions.assertThrows(RowScanException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, new Labels()));

		Assertions.assertTrue(Arrays.asList(e.getSuppressed()).contains(releaseFailure), "Release failure should be suppressed");
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testReleaseFailureDoesNotMaskTerminalError() {
		TerminalCursorException terminalFailure = new TerminalCursorException("stream fault");
		CursorReleaseException releaseFailure = new CursorReleaseException("unable to close");
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of())
				.failAfterLastRow(terminalFailure)
				.failRelease(releaseFailure);

		TerminalCursorException e = Assertions.assertThrows(TerminalCursorException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, new Labels()));

		Assertions.assertSame(terminalFailure, e);
		Assertions.assertArrayEquals(new Throwable[]{releaseFailure}, e.getSuppressed());
	}

	@Test
	public void testCursorClosedWhenAccumulatorFails() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one")));
		RecordSetAccumulator exhaustedAccumulator = () -> {
			throw new IllegalStateException("out of capacity");
		};

		IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, exhaustedAccumulator));

		Assertions.assertEquals("out of capacity", e.getMessage());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testNullCursorRejected() {
		Assertions.assertThrows(IllegalStateException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll((parameters) -> null, new Labels()));
	}

	@Test
	public void testNullBinderRejectedAndCursorClosed() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one")));

		IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, () -> null));

		Assertions.assertTrue(e.getMessage().contains("null SingleRecordBinder"), e.getMessage());
		Assertions.assertEquals(0, statementExecutor.getScanCalls());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testNullTargetListRejectedAndCursorClosed() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one")));

		IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, () -> () -> null));

		Assertions.assertTrue(e.getMessage().endsWith("returned null write targets"), e.getMessage());
		Assertions.assertEquals(0, statementExecutor.getScanCalls());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testNullTargetElementRejectedAndCursorClosed() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of(List.of(1, "one")));
		RecordSetAccumulator recordSetAccumulator = () -> () -> Arrays.asList(
				WriteTarget.of(Integer.class, value -> {}),
				(WriteTarget<?>) null);

		IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
				() -> RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, recordSetAccumulator));

		Assertions.assertTrue(e.getMessage().endsWith("returned a null write target for column 2"), e.getMessage());
		Assertions.assertEquals(0, statementExecutor.getScanCalls());
		Assertions.assertEquals(1, statementExecutor.getCloseCalls());
	}

	@Test
	public void testTypedParameterListBindsOneParameterPerElement() {
		FakeStatementExecutor statementExecutor = FakeStatementExecutor.withRows(List.of());
		List<Integer> ownerIds = List.of(7, 8, 9);

		RowMaterializer.withDefaultConfiguration().materializeAll(statementExecutor, new Labels(), ownerIds);

		Assertions.assertEquals(List.of(7, 8, 9), statementExecutor.getExecutedParameters());
	}

	@Test
	public void testListAccumulator() {
		List<Label> labels = new ArrayList<>();
		RecordSetAccumulator recordSetAccumulator = RecordSetAccumulator.forList(labels, Label::new, label -> label);

		Long rowCount = RowMaterializer.withDefaultConfiguration().materializeAll(FakeStatementExecutor.withRows(List.of(
				List.of(10, "ten"),
				Arrays.asList(20, null)
		)), recordSetAccumulator);

		Assertions.assertEquals(2L, rowCount);
		Assertions.assertEquals(10, labels.get(0).getId());
		Assertions.assertEquals("ten", labels.get(0).getName());
		Assertions.assertEquals(20, labels.get(1).getId());
		Assertions.assertNull(labels.get(1).getName());
	}

	@Test
	public void testListAccumulatorWithSeparateBinder() {
		List<StringBuilder> names = new ArrayList<>();
		RecordSetAccumulator recordSetAccumulator = RecordSetAccumulator.forList(names, StringBuilder::new,
				name -> () -> List.of(WriteTarget.of(String.class, value -> name.append(value))));

		RowMaterializer.withDefaultConfiguration().materializeAll(FakeStatementExecutor.withRows(List.of(
				List.of("first"),
				List.of("second")
		)), recordSetAccumulator);

		Assertions.assertEquals(List.of("first", "second"), names.stream().map(StringBuilder::toString).collect(Collectors.toList()));
	}

	@Test
	public void testNonNullTargetRejectsNull() {
		WriteTarget<Integer> target = WriteTarget.nonNull(Integer.class, value -> {});

		Assertions.assertFalse(target.isNullable());
		Assertions.assertThrows(IllegalArgumentException.class, () -> target.write(null));
	}
}
