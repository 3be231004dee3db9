package edu.bistu.scoreboard.board;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ProblemView
{
    public enum State
    {
        UNATTEMPTED,
        SOLVED,
        UNSOLVED,
        HIDDEN
    }

    private final char problem;
    private final boolean solved;
    private final int wrongAttempts;
    private final int pendingCount;
    private final boolean hidden;

    static ProblemView of(ProblemRecord record, boolean frozen)
    {
        boolean hidden = frozen && !record.isSolved() && record.hasPending();
        return new ProblemView(record.getProblem(), record.isSolved(), record.getWrongAttempts(),
                record.getPendingCount(), hidden);
    }

    public State getState()
    {
        if(hidden)
            return State.HIDDEN;
        if(solved)
            return State.SOLVED;
        return wrongAttempts == 0 ? State.UNATTEMPTED : State.UNSOLVED;
    }
}
