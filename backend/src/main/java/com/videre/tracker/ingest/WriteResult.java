package com.videre.tracker.ingest;

/**
 * Outcome of an idempotent create. {@code created} tells whether this call performed the
 * insert, not whether the row exists.
 */
public final class WriteResult<T> {

    public enum Status {
        /** This call inserted the row. */
        CREATED,
        /** The row was already there, or another writer won the race. */
        EXISTING,
        /** The parent never became visible within the wait bound. */
        ABANDONED,
        /** Unexpected storage failure, already logged. */
        FAILED
    }

    private final Status status;
    private final T model;

    private WriteResult(Status status, T model) {
        this.status = status;
        this.model = model;
    }

    public static <T> WriteResult<T> created(T model) { return new WriteResult<>(Status.CREATED, model); }
    public static <T> WriteResult<T> existing(T model) { return new WriteResult<>(Status.EXISTING, model); }
    public static <T> WriteResult<T> abandoned() { return new WriteResult<>(Status.ABANDONED, null); }
    public static <T> WriteResult<T> failed() { return new WriteResult<>(Status.FAILED, null); }

    public Status getStatus() { return status; }
    public boolean isCreated() { return status == Status.CREATED; }
    public T getModel() { return model; }

    /** True when the row is durable after this call, whoever inserted it. */
    public boolean isPersisted() {
        return status == Status.CREATED || status == Status.EXISTING;
    }

    @Override
    public String toString() {
        return "WriteResult[" + status + "]";
    }
}
