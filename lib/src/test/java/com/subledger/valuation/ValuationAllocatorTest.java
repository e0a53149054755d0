package com.subledger.valuation;

import static com.subledger.testing.Fixtures.GB01;
import static com.subledger.testing.Fixtures.US02;
import static com.subledger.testing.Fixtures.buy;
import static com.subledger.testing.Fixtures.mtm;
import static com.subledger.testing.Fixtures.sameAmount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.ledger.AllocatedTrade;
import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.Trade;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ValuationAllocatorTest {

    private final ValuationAllocator allocator = new ValuationAllocator(10);

    @Test
    void allocatesProRataOnOpenNotional() {
        List<OpenTrade> lots =
                List.of(
                        open(buy("A", US02, "2025-01-02", "50", "4"), "30"),
                        open(buy("B", US02, "2025-01-02", "30", "5"), "30"));

        List<AllocatedTrade> allocated = allocator.allocate(lots, List.of(mtm(US02, "2025-01-08", "27")), null);

        assertEquals(2, allocated.size());
        assertTrue(sameAmount("120", allocated.get(0).getOpenNotional()));
        assertTrue(sameAmount("12", allocated.get(0).getMtmAllocated()));
        assertTrue(sameAmount("15", allocated.get(1).getMtmAllocated()));
        assertEquals(LocalDate.of(2025, 1, 8), allocated.get(1).getSnapshotDate());
    }

    @Test
    void lastLotTakesRoundingResidualSoSharesSumExactly() {
        List<OpenTrade> lots =
                List.of(
                        open(buy("A", GB01, "2025-01-01", "1", "1"), "1"),
                        open(buy("B", GB01, "2025-01-02", "1", "1"), "1"),
                        open(buy("C", GB01, "2025-01-03", "1", "1"), "1"));

        List<AllocatedTrade> allocated = allocator.allocate(lots, List.of(mtm(GB01, "2025-01-08", "100")), null);

        BigDecimal sum = BigDecimal.ZERO;
        for (AllocatedTrade trade : allocated) {
            sum = sum.add(trade.getMtmAllocated());
        }
        assertEquals(0, new BigDecimal("100").compareTo(sum));
        assertEquals(new BigDecimal("33.3333333333"), allocated.get(0).getMtmAllocated());
        assertEquals(new BigDecimal("33.3333333334"), allocated.get(2).getMtmAllocated());
    }

    @Test
    void reallocatingTheAllocatedTotalIsIdempotent() {
        List<OpenTrade> lots =
                List.of(
                        open(buy("A", GB01, "2025-01-01", "7", "3"), "7"),
                        open(buy("B", GB01, "2025-01-02", "11", "2"), "5"));
        List<AllocatedTrade> first = allocator.allocate(lots, List.of(mtm(GB01, "2025-01-08", "-91.17")), null);
        BigDecimal total = first.get(0).getMtmAllocated().add(first.get(1).getMtmAllocated());

        List<AllocatedTrade> second = allocator.allocate(lots, List.of(mtm(GB01, "2025-01-08", total.toPlainString())), null);

        for (int i = 0; i < first.size(); i++) {
            assertEquals(0, first.get(i).getMtmAllocated().compareTo(second.get(i).getMtmAllocated()));
        }
    }

    @Test
    void zeroTotalNotionalAllocatesNothing() {
        List<OpenTrade> lots = List.of(open(buy("A", GB01, "2025-01-01", "10", "0"), "10"));

        List<AllocatedTrade> allocated = allocator.allocate(lots, List.of(mtm(GB01, "2025-01-08", "50")), null);

        assertEquals(0, allocated.get(0).getMtmAllocated().signum());
        assertTrue(sameAmount("50", allocated.get(0).getValuationAmount()));
    }

    @Test
    void lotsWithoutValuationCarryNullValuationAndZeroShare() {
        List<OpenTrade> lots = List.of(open(buy("A", GB01, "2025-01-01", "10", "2"), "10"));

        List<AllocatedTrade> allocated = allocator.allocate(lots, List.of(mtm(US02, "2025-01-08", "50")), null);

        assertEquals(1, allocated.size());
        assertFalse(allocated.get(0).hasValuation());
        assertNull(allocated.get(0).getValuationAmount());
        assertNull(allocated.get(0).getSnapshotDate());
        assertEquals(0, allocated.get(0).getMtmAllocated().signum());
    }

    @Test
    void asOfDateSelectsOneSnapshot() {
        List<OpenTrade> lots = List.of(open(buy("A", GB01, "2025-01-01", "10", "2"), "10"));

        List<AllocatedTrade> allocated =
                allocator.allocate(
                        lots,
                        List.of(mtm(GB01, "2025-01-07", "10"), mtm(GB01, "2025-01-08", "20")),
                        LocalDate.of(2025, 1, 8));

        assertEquals(1, allocated.size());
        assertTrue(sameAmount("20", allocated.get(0).getMtmAllocated()));
    }

    @Test
    void timeSeriesYieldsOneAllocationPerLotAndDate() {
        List<OpenTrade> lots =
                List.of(
                        open(buy("A", GB01, "2025-01-01", "10", "2"), "10"),
                        open(buy("B", GB01, "2025-01-02", "10", "2"), "10"));

        List<AllocatedTrade> allocated =
                allocator.allocate(lots, List.of(mtm(GB01, "2025-01-08", "20"), mtm(GB01, "2025-01-07", "10")), null);

        assertEquals(4, allocated.size());
        assertEquals(LocalDate.of(2025, 1, 7), allocated.get(0).getSnapshotDate());
        assertTrue(sameAmount("5", allocated.get(0).getMtmAllocated()));
        assertTrue(sameAmount("10", allocated.get(3).getMtmAllocated()));
    }

    private static OpenTrade open(Trade trade, String remaining) {
        return new OpenTrade(trade, new BigDecimal(remaining));
    }
}
