package edu.bistu.scoreboard.board;

import lombok.Getter;

/**
 * Outcome of a board operation. A failed reply never carries a value;
 * a successful one may carry none, e.g. a query without a match.
 */
@Getter
public class Reply<T>
{
    private final OperationStatus status;
    private final T value;

    private Reply(OperationStatus status, T value)
    {
        this.status = status;
        this.value = value;
    }

    public static <T> Reply<T> ok()
    {
        return new Reply<>(OperationStatus.OK, null);
    }

    public static <T> Reply<T> ok(T value)
    {
        return new Reply<>(OperationStatus.OK, value);
    }

    public static <T> Reply<T> fail(OperationStatus status)
    {
        if(status == OperationStatus.OK)
            throw new IllegalArgumentException("a failed reply needs a failure status");
        return new Reply<>(status, null);
    }

    public boolean isOk()
    {
        return status == OperationStatus.OK;
    }

    @Override
    public String toString()
    {
        return status + (value == null ? "" : " " + value);
    }
}
