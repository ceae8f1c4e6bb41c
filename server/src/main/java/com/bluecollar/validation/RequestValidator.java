package com.bluecollar.validation;

import com.bluecollar.common.status.Violation;
import com.google.common.collect.ImmutableList;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ElementKind;
import jakarta.validation.Path;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import java.lang.annotation.Annotation;
import java.lang.reflect.RecordComponent;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;
import org.hibernate.validator.HibernateValidator;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/**
 * Runs Bean Validation over request objects and reports every failed constraint as a
 * {@link Violation}.
 *
 * <p>Violations are ordered by the position of the offending field in the request record, then
 * by list index, so the same bad input always produces the same response. Field paths use bracket
 * notation for list elements ({@code skills[3]}).
 *
 * <p>Two message suffixes are added here because the parameter-only interpolator cannot see the
 * rejected value: {@code @Size} on a string field gets {@code " (received N characters)"} and
 * {@code @DecimalMin}/{@code @DecimalMax} get {@code " (received X)"}.
 */
public final class RequestValidator implements AutoCloseable {

  private final ValidatorFactory factory;
  private final Validator validator;

  public RequestValidator() {
    this.factory =
        Validation.byProvider(HibernateValidator.class)
            .configure()
            .messageInterpolator(new ParameterMessageInterpolator())
            .buildValidatorFactory();
    this.validator = factory.getValidator();
  }

  /**
   * Validates a request against the given groups (the default group if none are given).
   *
   * @return every violation, in field order; empty if the request is valid
   */
  @Nonnull
  public <T> List<Violation> validate(@Nonnull T request, Class<?>... groups) {
    Set<ConstraintViolation<T>> violations = validator.validate(request, groups);
    if (violations.isEmpty()) {
      return ImmutableList.of();
    }
    Comparator<ConstraintViolation<T>> order =
        Comparator.<ConstraintViolation<T>>comparingInt(
                v -> componentIndex(request.getClass(), v.getPropertyPath()))
            .thenComparingInt(v -> elementIndex(v.getPropertyPath()))
            .thenComparing(ConstraintViolation::getMessage);
    return violations.stream()
        .sorted(order)
        .map(v -> new Violation(fieldPath(v.getPropertyPath()), describe(v)))
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public void close() {
    factory.close();
  }

  /** Formats a property path as {@code field}, {@code field[index]} or {@code outer.inner}. */
  static String fieldPath(Path path) {
    StringBuilder sb = new StringBuilder();
    for (Path.Node node : path) {
      if (node.getKind() == ElementKind.CONTAINER_ELEMENT) {
        if (node.getIndex() != null) {
          sb.append('[').append(node.getIndex()).append(']');
        }
      } else if (node.getName() != null) {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(node.getName());
      }
    }
    return sb.toString();
  }

  private static String describe(ConstraintViolation<?> violation) {
    Annotation constraint = violation.getConstraintDescriptor().getAnnotation();
    Object invalid = violation.getInvalidValue();
    boolean topLevel = isTopLevel(violation.getPropertyPath());
    if (constraint instanceof Size && topLevel && invalid instanceof CharSequence) {
      return violation.getMessage()
          + " (received " + ((CharSequence) invalid).length() + " characters)";
    }
    if ((constraint instanceof DecimalMin || constraint instanceof DecimalMax) && invalid != null) {
      return violation.getMessage() + " (received " + invalid + ")";
    }
    return violation.getMessage();
  }

  private static boolean isTopLevel(Path path) {
    int count = 0;
    for (Path.Node ignored : path) {
      count++;
    }
    return count == 1;
  }

  private static int componentIndex(Class<?> type, Path path) {
    String first = null;
    for (Path.Node node : path) {
      first = node.getName();
      break;
    }
    RecordComponent[] components = type.getRecordComponents();
    if (first != null && components != null) {
      for (int i = 0; i < components.length; i++) {
        if (components[i].getName().equals(first)) {
          return i;
        }
      }
    }
    return Integer.MAX_VALUE;
  }

  private static int elementIndex(Path path) {
    for (Path.Node node : path) {
      if (node.getIndex() != null) {
        return node.getIndex();
      }
    }
    return -1;
  }
}
