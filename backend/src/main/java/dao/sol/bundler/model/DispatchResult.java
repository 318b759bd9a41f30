package dao.sol.bundler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Aggregate over every unit attempted. {@code success} is true when at least one unit succeeded;
 * {@code error} is set whenever any unit failed.
 */
public record DispatchResult(
        boolean success,
        List<DispatchUnitResult> units,
        String error
) {

    public DispatchResult {
        units = units == null ? List.of() : List.copyOf(units);
    }

    public static DispatchResult aggregate(List<DispatchUnitResult> units) {
        long succeeded = units.stream().filter(DispatchUnitResult::success).count();
        long failed = units.size() - succeeded;
        String error = failed > 0 ? failed + " failed, " + succeeded + " succeeded" : null;
        return new DispatchResult(succeeded > 0, units, error);
    }

    /**
     * Failure before any unit could be formed (e.g. nothing came back from the builder).
     */
    public static DispatchResult failure(String error, Throwable cause) {
        DispatchUnitResult unit = new DispatchUnitResult("dispatch", false, List.of(), error, cause);
        return new DispatchResult(false, List.of(unit), error);
    }

    public long succeededUnits() {
        return units.stream().filter(DispatchUnitResult::success).count();
    }

    public long failedUnits() {
        return units.size() - succeededUnits();
    }

    public List<RelayAck> acks() {
        return units.stream().flatMap(u -> u.acks().stream()).toList();
    }

    @JsonIgnore
    public Throwable firstFailureCause() {
        return units.stream()
                .filter(u -> !u.success() && u.cause() != null)
                .map(DispatchUnitResult::cause)
                .findFirst()
                .orElse(null);
    }
}
