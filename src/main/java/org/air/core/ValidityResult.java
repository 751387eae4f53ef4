package org.air.core;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * check-valid 的结果：Valid、Invalid (失败标签与可选的变量赋值) 或 SolverError (原因)。
 * "无法证明" (SOLVER_ERROR) 与 "被证伪" (INVALID) 必须区分开。
 */
@Getter
public final class ValidityResult {

    public enum Status {
        VALID,
        INVALID,
        SOLVER_ERROR
    }

    private static final ValidityResult VALID = new ValidityResult(Status.VALID, List.of(), Map.of(), null);

    private final Status status;
    // 按查询中的出现顺序
    private final List<String> failingLabels;
    private final SortedMap<String, String> model;
    private final String reason;

    private ValidityResult(Status status, List<String> failingLabels, Map<String, String> model, String reason) {
        this.status = status;
        this.failingLabels = List.copyOf(failingLabels);
        this.model = Collections.unmodifiableSortedMap(new TreeMap<>(model));
        this.reason = reason;
    }

    public static ValidityResult valid() {
        return VALID;
    }

    public static ValidityResult invalid(List<String> failingLabels, Map<String, String> model) {
        return new ValidityResult(Status.INVALID,
                Objects.requireNonNull(failingLabels, "failing labels cannot be null"),
                Objects.requireNonNull(model, "model cannot be null"), null);
    }

    public static ValidityResult solverError(String reason) {
        return new ValidityResult(Status.SOLVER_ERROR, List.of(), Map.of(),
                Objects.requireNonNull(reason, "reason cannot be null"));
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public boolean isInvalid() {
        return status == Status.INVALID;
    }

    public boolean isSolverError() {
        return status == Status.SOLVER_ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidityResult that = (ValidityResult) o;
        return status == that.status && failingLabels.equals(that.failingLabels)
                && model.equals(that.model) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, failingLabels, model, reason);
    }

    @Override
    public String toString() {
        return switch (status) {
            case VALID -> "Valid";
            case INVALID -> "Invalid(" + String.join(", ", failingLabels) + ")" +
                    (model.isEmpty() ? "" : model.entrySet().stream()
                            .map(e -> e.getKey() + "=" + e.getValue())
                            .collect(Collectors.joining(", ", " {", "}")));
            case SOLVER_ERROR -> "SolverError(" + reason + ")";
        };
    }
}
