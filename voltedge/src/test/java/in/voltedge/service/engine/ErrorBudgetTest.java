package in.voltedge.service.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorBudgetTest {

    @Test
    void testHaltsWhenBudgetReached() {
        ErrorBudget budget = new ErrorBudget(3);
        budget.recordUnexpected("entry:BTCUSD", "NullPointerException");
        budget.recordUnexpected("exit:ETHUSD", "parse error");

        EngineHaltedException e = assertThrows(EngineHaltedException.class,
            () -> budget.recordUnexpected("market-data", "boom"));

        assertEquals("market-data", e.getSource());
        assertTrue(e.getMessage().contains("3/3"));
        assertEquals(3, budget.getCount());
    }
}
