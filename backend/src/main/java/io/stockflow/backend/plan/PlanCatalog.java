package io.stockflow.backend.plan;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Code-defined plan table and the pricing rules applied to it. All prices are whole Colombian
 * pesos; gateway amounts are expressed in cents.
 */
public final class PlanCatalog {

  public static final String CURRENCY = "COP";

  public static final SubscriptionPlan BASE_PLAN = SubscriptionPlan.EMPRENDEDOR;

  private static final Locale PRICE_LOCALE = Locale.forLanguageTag("es-CO");

  private static final PlanLimits EMPRENDEDOR =
      new PlanLimits(
          "Emprendedor",
          "Para negocios que inician",
          69_900L,
          2,
          1,
          1,
          PlanLimits.UNLIMITED,
          PlanLimits.UNLIMITED,
          5,
          List.of(
              "1 usuario + 1 contador",
              "1 bodega",
              "Productos ilimitados",
              "Facturación electrónica ilimitada"));

  private static final PlanLimits PYME =
      new PlanLimits(
          "Pyme",
          "Para pequeñas empresas en crecimiento",
          149_900L,
          3,
          1,
          2,
          PlanLimits.UNLIMITED,
          PlanLimits.UNLIMITED,
          15,
          List.of(
              "2 usuarios + 1 contador",
              "2 bodegas",
              "Productos ilimitados",
              "Facturación electrónica ilimitada",
              "Nómina electrónica"));

  private static final PlanLimits PRO =
      new PlanLimits(
          "Pro",
          "Para empresas con varias sedes",
          219_900L,
          4,
          1,
          10,
          PlanLimits.UNLIMITED,
          PlanLimits.UNLIMITED,
          50,
          List.of(
              "3 usuarios + 1 contador",
              "10 bodegas",
              "Productos ilimitados",
              "Facturación electrónica ilimitada",
              "Nómina electrónica",
              "Reportes avanzados"));

  private static final PlanLimits PLUS =
      new PlanLimits(
          "Plus",
          "Para operaciones de alto volumen",
          279_900L,
          9,
          1,
          100,
          PlanLimits.UNLIMITED,
          PlanLimits.UNLIMITED,
          PlanLimits.UNLIMITED,
          List.of(
              "8 usuarios + 1 contador",
              "100 bodegas",
              "Productos ilimitados",
              "Facturación electrónica ilimitada",
              "Nómina electrónica ilimitada",
              "Reportes avanzados",
              "Soporte prioritario"));

  public static PlanLimits limitsOf(SubscriptionPlan plan) {
    Objects.requireNonNull(plan, "plan");
    return switch (plan) {
      case EMPRENDEDOR -> EMPRENDEDOR;
      case PYME -> PYME;
      case PRO -> PRO;
      case PLUS -> PLUS;
    };
  }

  public static int periodDays(SubscriptionPeriod period) {
    Objects.requireNonNull(period, "period");
    return switch (period) {
      case MONTHLY -> 30;
      case QUARTERLY -> 90;
      case ANNUAL -> 365;
    };
  }

  public static int periodMultiplier(SubscriptionPeriod period) {
    Objects.requireNonNull(period, "period");
    return switch (period) {
      case MONTHLY -> 1;
      case QUARTERLY -> 3;
      case ANNUAL -> 12;
    };
  }

  /** Discount as a fraction of the undiscounted total (0.10 = 10%). */
  public static BigDecimal periodDiscount(SubscriptionPeriod period) {
    Objects.requireNonNull(period, "period");
    return switch (period) {
      case MONTHLY -> BigDecimal.ZERO;
      case QUARTERLY -> new BigDecimal("0.10");
      case ANNUAL -> new BigDecimal("0.20");
    };
  }

  /**
   * Total price of one period: {@code monthlyPrice x multiplier x (1 - discount)}, rounded half-up
   * to whole pesos.
   */
  public static long price(SubscriptionPlan plan, SubscriptionPeriod period) {
    var gross =
        BigDecimal.valueOf(limitsOf(plan).monthlyPrice())
            .multiply(BigDecimal.valueOf(periodMultiplier(period)));
    var net = gross.multiply(BigDecimal.ONE.subtract(periodDiscount(period)));
    return net.setScale(0, RoundingMode.HALF_UP).longValueExact();
  }

  public static long amountInCents(SubscriptionPlan plan, SubscriptionPeriod period) {
    return Math.multiplyExact(price(plan, period), 100L);
  }

  /** Effective per-month price of a period, rounded to whole pesos. */
  public static long monthlyEquivalent(SubscriptionPlan plan, SubscriptionPeriod period) {
    return BigDecimal.valueOf(price(plan, period))
        .divide(BigDecimal.valueOf(periodMultiplier(period)), 0, RoundingMode.HALF_UP)
        .longValueExact();
  }

  /** Whether the plan can be bought through the hosted checkout. */
  public static boolean isPurchasable(SubscriptionPlan plan) {
    return plan != BASE_PLAN;
  }

  /** Formats a peso amount the way the checkout widget shows it, e.g. {@code $ 69.900}. */
  public static String formatPrice(long pesos) {
    var format = NumberFormat.getCurrencyInstance(PRICE_LOCALE);
    format.setMaximumFractionDigits(0);
    format.setMinimumFractionDigits(0);
    return format.format(pesos);
  }

  private PlanCatalog() {}
}
