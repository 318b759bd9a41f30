package dao.sol.bundler.exception;

import dao.sol.bundler.model.DispatchResult;

/**
 * Raised by callers that need a failed {@link DispatchResult} as an exception, e.g. to feed a retry policy.
 * The cause is the first unit failure, so transient network conditions stay visible.
 */
public class DispatchFailedException extends BundlerException {

    private final transient DispatchResult result;

    public DispatchFailedException(DispatchResult result) {
        super(result.error() != null ? result.error() : "Dispatch failed", result.firstFailureCause());
        this.result = result;
    }

    public DispatchResult getResult() {
        return result;
    }
}
