package reversi.impl;

import static org.junit.jupiter.api.Assertions.*;
import static reversi.constants.SearchConstants.TIME_FRACTIONS;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reversi.contracts.TimeManager;
import reversi.records.Board;
import reversi.records.Color;
import reversi.records.GameState;
import reversi.records.TimeAllocation;

class TimeManagerImplTest {

    private static final TimeManager TM = new TimeManagerImpl();

    private static GameState atTurn(int turn) {
        return new GameState(Board.initial(), turn % 2 == 0 ? Color.BLACK : Color.WHITE, turn);
    }

    @Test
    void tableCoversSeventyTurnsWithProperFractions() {
        assertEquals(70, TIME_FRACTIONS.length);
        for (double f : TIME_FRACTIONS) {
            assertTrue(f > 0.0 && f < 1.0, "fraction " + f);
        }
    }

    @Test
    void allocationNeverExceedsClock() {
        for (int turn = 0; turn < 70; turn++) {
            TimeAllocation ta = TM.calculate(atTurn(turn), 120_000);
            assertTrue(ta.turnMs() >= 0 && ta.turnMs() < 120_000);
            assertEquals(120_000, ta.turnMs() + ta.remainingAfterMs());
        }
    }

    @Test
    void openingTurnGetsSmallShare() {
        TimeAllocation ta = TM.calculate(atTurn(0), 100_000);
        assertEquals((long) (100_000 * 0.015), ta.turnMs());
    }

    @ParameterizedTest
    @ValueSource(ints = {70, 71, 100, 500})
    void turnsPastTableReuseLastEntry(int turn) {
        assertEquals(TIME_FRACTIONS[69], TimeManagerImpl.fraction(turn));
        assertEquals(TM.calculate(atTurn(69), 50_000).turnMs(), TM.calculate(atTurn(turn), 50_000).turnMs());
    }

    @Test
    void wholeGameStaysWithinBudget() {
        long remaining = 120_000;
        long spent = 0;
        for (int turn = 0; turn < 64; turn++) {
            TimeAllocation ta = TM.calculate(atTurn(turn), remaining);
            spent += ta.turnMs();
            remaining = ta.remainingAfterMs();
            assertTrue(remaining >= 0);
        }
        assertEquals(120_000, spent + remaining);
        assertTrue(remaining > 0);
    }

    @Test
    void zeroClockGivesZero() {
        assertEquals(new TimeAllocation(0, 0), TM.calculate(atTurn(10), 0));
    }

    @Test
    void rejectsNegativeInputs() {
        assertThrows(IllegalArgumentException.class, () -> TM.calculate(atTurn(3), -1));
        assertThrows(IllegalArgumentException.class, () -> TimeManagerImpl.fraction(-1));
    }
}
