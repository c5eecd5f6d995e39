package de.bsommerfeld.students.db;

/**
 * Outcome of a single {@link StudentRepository} operation: either a value or
 * a classified failure with its cause.
 *
 * <p>
 * A zero affected-row count is a successful result; "not found" is for the
 * caller to interpret.
 *
 * @param status outcome category
 * @param value  the result on {@link Status#SUCCESS}, otherwise {@code null}
 * @param error  the cause on failure, otherwise {@code null}
 * @param <T>    type of the successful value
 */
public record OperationResult<T>(Status status, T value, Exception error) {

    public enum Status {
        SUCCESS,
        /** The database rejected a duplicate value in a unique column. */
        UNIQUE_VIOLATION,
        /** Anything else: connectivity, SQL errors, missing resources. */
        UNEXPECTED
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(Status.SUCCESS, value, null);
    }

    public static <T> OperationResult<T> uniqueViolation(Exception error) {
        return new OperationResult<>(Status.UNIQUE_VIOLATION, null, error);
    }

    public static <T> OperationResult<T> unexpected(Exception error) {
        return new OperationResult<>(Status.UNEXPECTED, null, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Returns the cause's message, falling back to its class name when the
     * message is empty. {@code null} for successful results.
     */
    public String errorMessage() {
        if (error == null)
            return null;
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }
}
