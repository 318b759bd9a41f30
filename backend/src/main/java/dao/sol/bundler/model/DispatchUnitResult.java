package dao.sol.bundler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of one dispatch unit: a wallet (single), a group (batch) or a sub-bundle (all-in-one).
 */
public record DispatchUnitResult(
        String unit,
        boolean success,
        List<RelayAck> acks,
        String error,
        @JsonIgnore Throwable cause
) {

    public DispatchUnitResult {
        acks = acks == null ? List.of() : List.copyOf(acks);
    }

    public static DispatchUnitResult succeeded(String unit, List<RelayAck> acks) {
        return new DispatchUnitResult(unit, true, acks, null, null);
    }

    public static DispatchUnitResult failed(String unit, Throwable cause) {
        return new DispatchUnitResult(unit, false, List.of(), cause.getMessage(), cause);
    }

    public static DispatchUnitResult failed(String unit, String error) {
        return new DispatchUnitResult(unit, false, List.of(), error, null);
    }
}
