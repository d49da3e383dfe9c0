package dev.citecrawl.crawl;

import java.util.Collection;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit result of one collaborator call as seen by the crawler.
 *
 * @param status whether the call produced a usable value
 * @param value the value (an empty value for {@code EMPTY}, null for {@code FAILURE})
 * @param error failure description, null unless {@code FAILURE}
 */
public record Outcome<T>(Status status, @Nullable T value, @Nullable String error) {

  private static final Logger log = LoggerFactory.getLogger(Outcome.class);

  public enum Status {
    SUCCESS,
    EMPTY,
    FAILURE
  }

  public static <T> Outcome<T> success(T value) {
    return new Outcome<>(Status.SUCCESS, value, null);
  }

  public static <T> Outcome<T> empty(T emptyValue) {
    return new Outcome<>(Status.EMPTY, emptyValue, null);
  }

  public static <T> Outcome<T> failure(String error) {
    return new Outcome<>(Status.FAILURE, null, error);
  }

  /**
   * Run a collaborator call, classifying its result. Exceptions become {@code FAILURE} and are
   * logged; null, empty strings and empty collections become {@code EMPTY}.
   *
   * @param description what the call does, for the log
   * @param call the call
   * @param emptyValue value handed out for EMPTY and FAILURE outcomes via {@link #orElse}
   */
  public static <T> Outcome<T> of(String description, Supplier<T> call, T emptyValue) {
    T value;
    try {
      value = call.get();
    } catch (RuntimeException e) {
      log.warn("{} failed: {}", description, e.getMessage());
      return failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }
    if (isEmptyValue(value)) {
      return empty(emptyValue);
    }
    return success(value);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  public boolean isFailure() {
    return status == Status.FAILURE;
  }

  /** The value when present, otherwise the fallback. */
  public T orElse(T fallback) {
    return value == null ? fallback : value;
  }

  private static boolean isEmptyValue(@Nullable Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof String s) {
      return s.isBlank();
    }
    if (value instanceof Collection<?> c) {
      return c.isEmpty();
    }
    return false;
  }
}
