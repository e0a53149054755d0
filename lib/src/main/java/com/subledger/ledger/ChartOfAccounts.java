package com.subledger.ledger;

import java.util.Objects;

/**
 * The fixed set of GL accounts the subledger posts to. Built once per run from configuration and
 * passed explicitly to every poster and control.
 */
public final class ChartOfAccounts {
    public static final String DEFAULT_SECURITY_ASSET = "200100";
    public static final String DEFAULT_CASH = "100000";
    public static final String DEFAULT_REALIZED_PNL = "300100";
    public static final String DEFAULT_REVALUATION = "400200";
    public static final String DEFAULT_UNREALIZED_PNL = "400100";

    private static final ChartOfAccounts DEFAULTS =
            new ChartOfAccounts(
                    DEFAULT_SECURITY_ASSET,
                    DEFAULT_CASH,
                    DEFAULT_REALIZED_PNL,
                    DEFAULT_REVALUATION,
                    DEFAULT_UNREALIZED_PNL);

    private final String securityAsset;
    private final String cash;
    private final String realizedPnl;
    private final String revaluation;
    private final String unrealizedPnl;

    public ChartOfAccounts(
            String securityAsset, String cash, String realizedPnl, String revaluation, String unrealizedPnl) {
        this.securityAsset = Objects.requireNonNull(securityAsset, "securityAsset");
        this.cash = Objects.requireNonNull(cash, "cash");
        this.realizedPnl = Objects.requireNonNull(realizedPnl, "realizedPnl");
        this.revaluation = Objects.requireNonNull(revaluation, "revaluation");
        this.unrealizedPnl = Objects.requireNonNull(unrealizedPnl, "unrealizedPnl");
    }

    public static ChartOfAccounts defaults() {
        return DEFAULTS;
    }

    /** Balance sheet: securities held at cost. */
    public String getSecurityAsset() {
        return securityAsset;
    }

    public String getCash() {
        return cash;
    }

    public String getRealizedPnl() {
        return realizedPnl;
    }

    /** Balance sheet revaluation reserve; always reflects the latest MTM level. */
    public String getRevaluation() {
        return revaluation;
    }

    public String getUnrealizedPnl() {
        return unrealizedPnl;
    }
}
