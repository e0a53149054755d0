package com.subledger.engine;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.lots.OversellPolicy;
import com.subledger.posting.CostBasisPolicy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/**
 * Run settings read from {@link Properties}. Every key is prefixed with {@code subledger.}; a JVM
 * system property of the same name overrides the supplied value.
 *
 * <pre>
 *   subledger.tolerance          break threshold for controls       (0.000001)
 *   subledger.scale              decimals kept by divisions          (8, the SQL amount scale)
 *   subledger.parallelism        worker threads, 1 runs inline       (1)
 *   subledger.oversellPolicy     IGNORE | REPORT | REJECT            (REPORT)
 *   subledger.costBasisPolicy    PRESERVE | CLAMP | FLAG             (PRESERVE)
 *   subledger.asOfDate           ISO date, trade and feed cut-off    (none)
 *   subledger.account.*          securityAsset, cash, realizedPnl, revaluation, unrealizedPnl
 * </pre>
 */
public final class SubledgerOptions {

    public static final String PREFIX = "subledger.";
    public static final String TOLERANCE = PREFIX + "tolerance";
    public static final String SCALE = PREFIX + "scale";
    public static final String PARALLELISM = PREFIX + "parallelism";
    public static final String OVERSELL_POLICY = PREFIX + "oversellPolicy";
    public static final String COST_BASIS_POLICY = PREFIX + "costBasisPolicy";
    public static final String AS_OF_DATE = PREFIX + "asOfDate";
    public static final String ACCOUNT_SECURITY_ASSET = PREFIX + "account.securityAsset";
    public static final String ACCOUNT_CASH = PREFIX + "account.cash";
    public static final String ACCOUNT_REALIZED_PNL = PREFIX + "account.realizedPnl";
    public static final String ACCOUNT_REVALUATION = PREFIX + "account.revaluation";
    public static final String ACCOUNT_UNREALIZED_PNL = PREFIX + "account.unrealizedPnl";

    private final BigDecimal tolerance;
    private final int scale;
    private final int parallelism;
    private final OversellPolicy oversellPolicy;
    private final CostBasisPolicy costBasisPolicy;
    private final LocalDate asOfDate;
    private final ChartOfAccounts accounts;

    private SubledgerOptions(
            BigDecimal tolerance,
            int scale,
            int parallelism,
            OversellPolicy oversellPolicy,
            CostBasisPolicy costBasisPolicy,
            LocalDate asOfDate,
            ChartOfAccounts accounts) {
        this.tolerance = tolerance;
        this.scale = scale;
        this.parallelism = parallelism;
        this.oversellPolicy = oversellPolicy;
        this.costBasisPolicy = costBasisPolicy;
        this.asOfDate = asOfDate;
        this.accounts = accounts;
    }

    public static SubledgerOptions defaults() {
        return fromProperties(new Properties());
    }

    public static SubledgerOptions fromProperties(Properties properties) {
        Properties effective = new Properties();
        if (properties != null) {
            effective.putAll(properties);
        }
        setDefault(effective, TOLERANCE, "0.000001");
        setDefault(effective, SCALE, "8");
        setDefault(effective, PARALLELISM, "1");
        setDefault(effective, OVERSELL_POLICY, OversellPolicy.REPORT.name());
        setDefault(effective, COST_BASIS_POLICY, CostBasisPolicy.PRESERVE.name());
        setDefault(effective, ACCOUNT_SECURITY_ASSET, ChartOfAccounts.DEFAULT_SECURITY_ASSET);
        setDefault(effective, ACCOUNT_CASH, ChartOfAccounts.DEFAULT_CASH);
        setDefault(effective, ACCOUNT_REALIZED_PNL, ChartOfAccounts.DEFAULT_REALIZED_PNL);
        setDefault(effective, ACCOUNT_REVALUATION, ChartOfAccounts.DEFAULT_REVALUATION);
        setDefault(effective, ACCOUNT_UNREALIZED_PNL, ChartOfAccounts.DEFAULT_UNREALIZED_PNL);

        BigDecimal tolerance = parseDecimal(effective, TOLERANCE);
        if (tolerance.signum() < 0) {
            throw new IllegalArgumentException(TOLERANCE + " must not be negative: " + tolerance);
        }
        int scale = parseInt(effective, SCALE, 0);
        int parallelism = parseInt(effective, PARALLELISM, 1);
        OversellPolicy oversell = OversellPolicy.fromString(value(effective, OVERSELL_POLICY));
        if (oversell == null) {
            throw new IllegalArgumentException("Unknown " + OVERSELL_POLICY + ": " + value(effective, OVERSELL_POLICY));
        }
        CostBasisPolicy costBasis = CostBasisPolicy.fromString(value(effective, COST_BASIS_POLICY));
        if (costBasis == null) {
            throw new IllegalArgumentException(
                    "Unknown " + COST_BASIS_POLICY + ": " + value(effective, COST_BASIS_POLICY));
        }
        ChartOfAccounts accounts =
                new ChartOfAccounts(
                        value(effective, ACCOUNT_SECURITY_ASSET),
                        value(effective, ACCOUNT_CASH),
                        value(effective, ACCOUNT_REALIZED_PNL),
                        value(effective, ACCOUNT_REVALUATION),
                        value(effective, ACCOUNT_UNREALIZED_PNL));
        return new SubledgerOptions(
                tolerance, scale, parallelism, oversell, costBasis, parseDate(effective, AS_OF_DATE), accounts);
    }

    /** Same settings with a different cut-off date; null removes the cut-off. */
    public SubledgerOptions withAsOfDate(LocalDate date) {
        return new SubledgerOptions(tolerance, scale, parallelism, oversellPolicy, costBasisPolicy, date, accounts);
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }

    public int getScale() {
        return scale;
    }

    public int getParallelism() {
        return parallelism;
    }

    public OversellPolicy getOversellPolicy() {
        return oversellPolicy;
    }

    public CostBasisPolicy getCostBasisPolicy() {
        return costBasisPolicy;
    }

    /** Cut-off date for trades and feeds, or null to take everything. */
    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public ChartOfAccounts getAccounts() {
        return accounts;
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }

    private static String value(Properties properties, String key) {
        String override = System.getProperty(key);
        return override != null ? override : properties.getProperty(key);
    }

    private static BigDecimal parseDecimal(Properties properties, String key) {
        String raw = value(properties, key);
        try {
            return Objects.requireNonNull(DecimalParser.parse(raw), key);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + key + ": " + raw, ex);
        }
    }

    private static int parseInt(Properties properties, String key, int minimum) {
        String raw = value(properties, key);
        int parsed;
        try {
            parsed = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + key + ": " + raw, ex);
        }
        if (parsed < minimum) {
            throw new IllegalArgumentException(key + " must be at least " + minimum + ": " + parsed);
        }
        return parsed;
    }

    private static LocalDate parseDate(Properties properties, String key) {
        String raw = value(properties, key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid " + key + ": " + raw, ex);
        }
    }
}
