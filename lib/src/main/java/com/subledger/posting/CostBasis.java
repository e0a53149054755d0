package com.subledger.posting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/** Running weighted-average cost state of one position: quantity held and total cost. */
public final class CostBasis {

    public static final CostBasis EMPTY = new CostBasis(BigDecimal.ZERO, BigDecimal.ZERO);

    private final BigDecimal quantity;
    private final BigDecimal cost;

    public CostBasis(BigDecimal quantity, BigDecimal cost) {
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.cost = Objects.requireNonNull(cost, "cost");
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getCost() {
        return cost;
    }

    /** {@code cost / quantity}, or null when nothing is held. */
    public BigDecimal averageCost(int scale) {
        if (quantity.signum() <= 0) {
            return null;
        }
        return cost.divide(quantity, scale, RoundingMode.HALF_EVEN);
    }

    /**
     * Cost released by selling {@code soldQuantity}: the average cost times the quantity, or the
     * sell price times the quantity when nothing is held.
     */
    public BigDecimal costOfSale(BigDecimal soldQuantity, BigDecimal fallbackPrice, int scale) {
        if (quantity.signum() <= 0) {
            return fallbackPrice.multiply(soldQuantity);
        }
        return cost.multiply(soldQuantity).divide(quantity, scale, RoundingMode.HALF_EVEN);
    }

    public CostBasis afterBuy(BigDecimal boughtQuantity, BigDecimal notional) {
        return new CostBasis(quantity.add(boughtQuantity), cost.add(notional));
    }

    public CostBasis afterSale(BigDecimal soldQuantity, BigDecimal costOfSale) {
        return new CostBasis(quantity.subtract(soldQuantity), cost.subtract(costOfSale));
    }

    @Override
    public String toString() {
        return "CostBasis[quantity=" + quantity.toPlainString() + ", cost=" + cost.toPlainString() + "]";
    }
}
