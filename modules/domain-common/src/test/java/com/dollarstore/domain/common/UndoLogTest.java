package com.dollarstore.domain.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class UndoLogTest {
  @Test
  void shouldReplayUndoActionsNewestFirstOnRollback() {
    UndoLog undoLog = new UndoLog();
    List<String> replayed = new ArrayList<>();

    undoLog.begin();
    undoLog.record(() -> replayed.add("first"));
    undoLog.record(() -> replayed.add("second"));
    undoLog.record(() -> replayed.add("third"));
    undoLog.rollback();

    assertEquals(List.of("third", "second", "first"), replayed);
    assertFalse(undoLog.isActive());
  }

  @Test
  void shouldDiscardUndoActionsOnCommit() {
    UndoLog undoLog = new UndoLog();
    List<String> replayed = new ArrayList<>();

    undoLog.begin();
    undoLog.record(() -> replayed.add("first"));
    undoLog.commit();
    undoLog.rollback();

    assertTrue(replayed.isEmpty());
    assertEquals(0, undoLog.size());
  }

  @Test
  void shouldIgnoreChangesRecordedOutsideTransaction() {
    UndoLog undoLog = new UndoLog();

    undoLog.record(() -> {});

    assertEquals(0, undoLog.size());
  }

  @Test
  void shouldRejectNestedBegin() {
    UndoLog undoLog = new UndoLog();
    undoLog.begin();

    assertThrows(IllegalStateException.class, undoLog::begin);
  }
}
