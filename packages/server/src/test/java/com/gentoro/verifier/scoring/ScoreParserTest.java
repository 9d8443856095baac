package com.gentoro.verifier.scoring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ScoreParserTest {

  @Test
  void firstDigitRunIsTheScore() {
    assertEquals(OptionalInt.of(85), ScoreParser.parse("85"));
    assertEquals(OptionalInt.of(72), ScoreParser.parse("Score: 72/100"));
    assertEquals(OptionalInt.of(87), ScoreParser.parse("87.5"));
    assertEquals(OptionalInt.of(0), ScoreParser.parse("0"));
  }

  @Test
  void scoreIsClampedToHundred() {
    assertEquals(OptionalInt.of(100), ScoreParser.parse("150"));
    assertEquals(
        OptionalInt.of(100), ScoreParser.parse("rated 99999999999999999999 out of 100"));
  }

  @Test
  void signIsNotPartOfTheDigitRun() {
    assertEquals(OptionalInt.of(5), ScoreParser.parse("-5"));
  }

  @Test
  void noDigitsIsEmpty() {
    assertTrue(ScoreParser.parse("excellent").isEmpty());
    assertTrue(ScoreParser.parse("").isEmpty());
    assertTrue(ScoreParser.parse(null).isEmpty());
  }
}
