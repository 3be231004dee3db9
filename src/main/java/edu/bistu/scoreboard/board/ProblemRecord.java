package edu.bistu.scoreboard.board;

import lombok.Getter;
import shared.Submission;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Solve and attempt state of one team on one problem.
 * <p>
 * Once the problem is solved its solve time and wrong attempts stay fixed,
 * later submissions are kept in the audit trail only.
 */
public class ProblemRecord
{
    @Getter
    private final char problem;

    @Getter
    private boolean solved;

    @Getter
    private int solveTime;

    @Getter
    private int wrongAttempts;

    //every submission filed against this problem, frozen or not
    private final List<Submission> submissions = new ArrayList<>();

    //received while frozen and unsolved, in arrival order
    private final List<Submission> pendingFrozen = new ArrayList<>();

    public ProblemRecord(char problem)
    {
        this.problem = problem;
    }

    void record(Submission submission)
    {
        submissions.add(submission);
    }

    /**
     * Applies a visible submission.
     *
     * @return true if the submission solved the problem
     */
    boolean apply(Submission submission)
    {
        if(solved)
            return false;
        if(submission.getResult().isAccepted())
        {
            solved = true;
            solveTime = submission.getTime();
            return true;
        }
        wrongAttempts++;
        return false;
    }

    void hold(Submission submission)
    {
        pendingFrozen.add(submission);
    }

    /**
     * Replays the pending queue in arrival order and clears it.
     *
     * @return true if the problem became solved during the replay
     */
    boolean reveal()
    {
        boolean solvedNow = false;
        for(Submission submission : pendingFrozen)
        {
            if(apply(submission))
                solvedNow = true;
        }
        pendingFrozen.clear();
        return solvedNow;
    }

    public boolean hasPending()
    {
        return !pendingFrozen.isEmpty();
    }

    public int getPendingCount()
    {
        return pendingFrozen.size();
    }

    public List<Submission> getSubmissions()
    {
        return Collections.unmodifiableList(submissions);
    }

    public List<Submission> getPendingFrozen()
    {
        return Collections.unmodifiableList(pendingFrozen);
    }
}
