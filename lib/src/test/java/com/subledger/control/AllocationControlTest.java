package com.subledger.control;

import static com.subledger.testing.Fixtures.GB01;
import static com.subledger.testing.Fixtures.GB03;
import static com.subledger.testing.Fixtures.US02;
import static com.subledger.testing.Fixtures.buy;
import static com.subledger.testing.Fixtures.mtm;
import static com.subledger.testing.Fixtures.sameAmount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.ledger.AllocatedTrade;
import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.ValuationSnapshot;
import com.subledger.valuation.ValuationAllocator;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

final class AllocationControlTest {

    private final AllocationControl control = new AllocationControl(new BigDecimal("0.000001"));

    @Test
    void allocationsSumBackToValuation() {
        List<OpenTrade> lots =
                List.of(
                        new OpenTrade(buy("A", GB01, "2025-01-01", "3", "1"), new BigDecimal("3")),
                        new OpenTrade(buy("B", GB01, "2025-01-02", "7", "1"), new BigDecimal("7")));
        List<ValuationSnapshot> valuations = List.of(mtm(GB01, "2025-01-08", "10.01"));
        List<AllocatedTrade> allocated = new ValuationAllocator(10).allocate(lots, valuations, null);

        List<AllocationControlRecord> records = control.reconcile(allocated, valuations);

        assertEquals(1, records.size());
        assertEquals(ControlStatus.MATCHED, records.get(0).getStatus());
        assertTrue(sameAmount("10.01", records.get(0).getAllocatedSum()));
    }

    @Test
    void valuationWithoutOpenLotsIsMissingDerived() {
        List<AllocationControlRecord> records = control.reconcile(List.of(), List.of(mtm(GB03, "2025-01-08", "40")));

        assertEquals(ControlStatus.MISSING_DERIVED, records.get(0).getStatus());
        assertTrue(sameAmount("-40", records.get(0).getDifference()));
    }

    @Test
    void lotsWithoutValuationAreReportedWithZeroExpected() {
        List<OpenTrade> lots = List.of(new OpenTrade(buy("A", US02, "2025-01-01", "3", "1"), new BigDecimal("3")));
        List<AllocatedTrade> allocated = new ValuationAllocator(10).allocate(lots, List.of(), null);

        List<AllocationControlRecord> records = control.reconcile(allocated, List.of());

        assertEquals(1, records.size());
        assertNull(records.get(0).getSnapshotDate());
        assertEquals(0, records.get(0).getValuationAmount().signum());
        assertEquals(ControlStatus.MATCHED, records.get(0).getStatus());
    }
}
