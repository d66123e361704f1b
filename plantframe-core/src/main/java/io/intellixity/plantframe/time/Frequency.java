package io.intellixity.plantframe.time;

import java.time.*;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resampling frequency: an integer multiplier and a unit.\n
 *
 * Accepted forms: {@code S}, {@code min} / {@code T}, {@code H}, {@code D}, {@code MS} (month start), each with an
 * optional leading multiplier ({@code 10min}, {@code 1H}, {@code 3MS}).\n
 *
 * Buckets are left-closed, labelled by their start, and aligned in a zone: sub-day buckets to local midnight, days
 * and month starts to the calendar. Multi-day and multi-month buckets are aligned to the epoch (1970-01-01 and
 * 1970-01) so that every row maps to the same bucket regardless of which rows are present.\n
 */
public final class Frequency {
  private static final Pattern FORMAT = Pattern.compile("^\\s*(\\d*)\\s*([A-Za-z]+)\\s*$");
  private static final long DAY_MILLIS = 86_400_000L;

  public enum Unit {
    SECOND("S", 1_000L),
    MINUTE("min", 60_000L),
    HOUR("H", 3_600_000L),
    DAY("D", DAY_MILLIS),
    MONTH_START("MS", 0L);

    private final String code;
    private final long millis;

    Unit(String code, long millis) {
      this.code = code;
      this.millis = millis;
    }

    public String code() { return code; }
  }

  private final int multiplier;
  private final Unit unit;

  private Frequency(int multiplier, Unit unit) {
    if (multiplier < 1) throw new IllegalArgumentException("Frequency multiplier must be >= 1: " + multiplier);
    this.multiplier = multiplier;
    this.unit = Objects.requireNonNull(unit, "unit");
    if (isSubDay() && DAY_MILLIS % stepMillis() != 0) {
      throw new IllegalArgumentException("Sub-day frequency " + this + " must divide 24h");
    }
  }

  public static Frequency of(int multiplier, Unit unit) {
    return new Frequency(multiplier, unit);
  }

  public static Frequency parse(String text) {
    if (text == null) throw new IllegalArgumentException("frequency is required");
    Matcher m = FORMAT.matcher(text);
    if (!m.matches()) throw new IllegalArgumentException("Unsupported frequency '" + text + "'");
    int mult = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
    String u = m.group(2);
    Unit unit;
    switch (u) {
      case "S", "s" -> unit = Unit.SECOND;
      case "min", "T" -> unit = Unit.MINUTE;
      case "H", "h" -> unit = Unit.HOUR;
      case "D", "d" -> unit = Unit.DAY;
      case "MS" -> unit = Unit.MONTH_START;
      default -> throw new IllegalArgumentException("Unsupported frequency unit '" + u + "' in '" + text + "'");
    }
    return new Frequency(mult, unit);
  }

  public int multiplier() { return multiplier; }
  public Unit unit() { return unit; }

  public boolean isSubDay() {
    return unit == Unit.SECOND || unit == Unit.MINUTE || unit == Unit.HOUR;
  }

  private long stepMillis() {
    return unit.millis * multiplier;
  }

  /** Start of the bucket containing {@code t}. */
  public Instant bucketStart(Instant t, ZoneId zone) {
    Objects.requireNonNull(t, "t");
    Objects.requireNonNull(zone, "zone");
    LocalDate date = t.atZone(zone).toLocalDate();
    switch (unit) {
      case DAY: {
        long epochDay = date.toEpochDay();
        return LocalDate.ofEpochDay(epochDay - Math.floorMod(epochDay, multiplier)).atStartOfDay(zone).toInstant();
      }
      case MONTH_START: {
        long months = (long) (date.getYear() - 1970) * 12 + date.getMonthValue() - 1;
        long aligned = months - Math.floorMod(months, multiplier);
        return LocalDate.of(1970, 1, 1).plusMonths(aligned).atStartOfDay(zone).toInstant();
      }
      default: {
        Instant midnight = date.atStartOfDay(zone).toInstant();
        long sinceMidnight = Duration.between(midnight, t).toMillis();
        long step = stepMillis();
        return midnight.plusMillis(Math.floorDiv(sinceMidnight, step) * step);
      }
    }
  }

  /** Start of the bucket following the one starting at {@code bucketStart}. */
  public Instant next(Instant bucketStart, ZoneId zone) {
    switch (unit) {
      case DAY: {
        LocalDate d = bucketStart.atZone(zone).toLocalDate().plusDays(multiplier);
        return d.atStartOfDay(zone).toInstant();
      }
      case MONTH_START: {
        LocalDate d = bucketStart.atZone(zone).toLocalDate().withDayOfMonth(1).plusMonths(multiplier);
        return d.atStartOfDay(zone).toInstant();
      }
      default:
        return bucketStart(bucketStart.plusMillis(stepMillis()), zone);
    }
  }

  /** Length in hours of the bucket starting at {@code bucketStart} (calendar-aware for days and months). */
  public double periodHours(Instant bucketStart, ZoneId zone) {
    return Duration.between(bucketStart, next(bucketStart, zone)).toMillis() / 3_600_000.0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Frequency f && f.multiplier == multiplier && f.unit == unit;
  }

  @Override
  public int hashCode() {
    return Objects.hash(multiplier, unit);
  }

  @Override
  public String toString() {
    return (multiplier == 1 ? "" : Integer.toString(multiplier)) + unit.code;
  }

  /** Lower-case label usable in column or step names. */
  public String label() {
    return toString().toLowerCase(Locale.ROOT);
  }
}
