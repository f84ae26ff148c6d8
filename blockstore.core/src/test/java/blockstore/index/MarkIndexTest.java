package blockstore.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkIndexTest {

  @Test
  void addAndLocate() {
    MarkIndex marks = MarkIndex.EMPTY
      .addMark("b", 10)
      .addMark("a", 3)
      .addMark("c", 25);
    assertEquals(3, marks.size());
    assertEquals(Long.valueOf(3), marks.getMarkLocation("a"));
    assertEquals(Long.valueOf(10), marks.getMarkLocation("b"));
    assertEquals(Long.valueOf(25), marks.getMarkLocation("c"));
    assertNull(marks.getMarkLocation("d"));
    assertEquals(List.of(new MarkLocation("a", 3), new MarkLocation("b", 10), new MarkLocation("c", 25)),
                 marks.listMarks());
  }

  @Test
  void addingAnExistingNameMovesTheMark() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("a", 3).addMark("b", 8).addMark("a", 12);
    assertEquals(List.of(new MarkLocation("b", 8), new MarkLocation("a", 12)), marks.listMarks());
  }

  @Test
  void marksAtTheSameOffset() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("a", 5).addMark("b", 5);
    assertEquals(Long.valueOf(5), marks.getMarkLocation("a"));
    assertEquals(Long.valueOf(5), marks.getMarkLocation("b"));
  }

  @Test
  void removeKeepsFollowingOffsets() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("a", 3).addMark("b", 10).addMark("c", 25);
    marks = marks.removeMark("b");
    assertFalse(marks.contains("b"));
    assertEquals(Long.valueOf(25), marks.getMarkLocation("c"));
    assertSame(marks, marks.removeMark("missing"));
  }

  @Test
  void negativeOffsetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> MarkIndex.EMPTY.addMark("a", -1));
  }

  @Test
  void markAfterReplacementShifts() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("m", 10);
    assertEquals(Long.valueOf(7), marks.floatMarks(0, 5, 2).getMarkLocation("m"));
    assertEquals(Long.valueOf(15), marks.floatMarks(2, 2, 5).getMarkLocation("m"));
  }

  @Test
  void markBeforeReplacementStays() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("m", 3);
    assertEquals(Long.valueOf(3), marks.floatMarks(5, 8, 0).getMarkLocation("m"));
    assertEquals(Long.valueOf(3), marks.floatMarks(3, 6, 1).getMarkLocation("m"));
    assertEquals(Long.valueOf(3), marks.floatMarks(3, 3, 4).getMarkLocation("m"));
  }

  @Test
  void markInsideReplacementIsClampedToStart() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("before", 2).addMark("inside", 6).addMark("end", 8).addMark("after", 20);
    MarkIndex floated = marks.floatMarks(4, 8, 1);
    assertEquals(List.of(new MarkLocation("before", 2),
                         new MarkLocation("inside", 4),
                         new MarkLocation("end", 5),
                         new MarkLocation("after", 17)),
                 floated.listMarks());
  }

  @Test
  void markInsideGrowingReplacementMovesWithTheEdit() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("inside", 6).addMark("after", 9);
    MarkIndex floated = marks.floatMarks(4, 8, 10);
    assertEquals(Long.valueOf(12), floated.getMarkLocation("inside"));
    assertEquals(Long.valueOf(15), floated.getMarkLocation("after"));
  }

  @Test
  void sameLengthReplacementLeavesMarks() {
    MarkIndex marks = MarkIndex.EMPTY.addMark("m", 6);
    assertSame(marks, marks.floatMarks(4, 8, 4));
  }
}
