package tech.grantwell.engine.error;

/**
 * Outcome of an engine operation.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the response value</li>
 *   <li>{@link Failure} - contains the protocol error</li>
 * </ul>
 *
 * <p>Engine entry points never throw; every failure, including storage faults,
 * is returned as a {@link Failure}.
 */
public sealed interface OAuthResult<T> permits OAuthResult.Success, OAuthResult.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements OAuthResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(OAuthError error) implements OAuthResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> OAuthResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> OAuthResult<T> failure(OAuthError error) {
        return new Failure<>(error);
    }

    static <T> OAuthResult<T> serverError() {
        return new Failure<>(OAuthError.of(OAuthErrorCode.SERVER_ERROR,
            "The authorization server encountered an unexpected condition"));
    }
}
