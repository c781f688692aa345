package com.questrail.gridcheck.api;

/**
 * Validator
 * -----------------------------------------------------------------------------
 * A {@code Validator} decides whether a candidate value is well-formed
 * according to a fixed set of rules.
 *
 * <h2>Total Functions</h2>
 * Implementations are <b>total</b>: every input, including {@code null} and
 * structurally malformed values, maps to a {@link ValidationResult}. No
 * exception caused by the candidate may escape {@link #validate(Object)}.
 * There is no distinction between "invalid" and "malformed" input; both are
 * simply rejected.
 *
 * <h2>Purity</h2>
 * Validators must not mutate the candidate and must not keep per-call state
 * between invocations. A single instance may be shared freely across threads.
 *
 * @param <T> the candidate type
 */
public interface Validator<T>
{
    /**
     * Validates the candidate and reports the first rule it violates, if any.
     *
     * @param candidate the value to check (may be {@code null})
     * @return the outcome, never {@code null}
     */
    ValidationResult validate(T candidate);

    /**
     * Convenience for callers that only need the verdict.
     *
     * @param candidate the value to check (may be {@code null})
     * @return {@code true} if the candidate satisfies every rule
     */
    default boolean isValid(T candidate)
    {
        return validate(candidate).isValid();
    }
}
