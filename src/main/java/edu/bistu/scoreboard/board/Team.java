package edu.bistu.scoreboard.board;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Team
{
    @Getter
    private final String name;

    private final int penalty;

    //index 0 is problem A
    private final List<ProblemRecord> problems = new ArrayList<>();

    //null until read after the last mutation
    private TeamAggregate aggregate;

    public Team(String name, int penalty)
    {
        this.name = name;
        this.penalty = penalty;
    }

    void openProblems(int problemCount)
    {
        problems.clear();
        for(int i = 0; i < problemCount; i++)
        {
            problems.add(new ProblemRecord((char) ('A' + i)));
        }
        invalidate();
    }

    public ProblemRecord getProblem(char problem)
    {
        int index = problem - 'A';
        if(index < 0 || index >= problems.size())
            return null;
        return problems.get(index);
    }

    public List<ProblemRecord> getProblems()
    {
        return Collections.unmodifiableList(problems);
    }

    /**
     * @return the problem with the smallest letter that still holds frozen submissions, or null
     */
    ProblemRecord firstPendingProblem()
    {
        for(ProblemRecord record : problems)
        {
            if(record.hasPending())
                return record;
        }
        return null;
    }

    void invalidate()
    {
        aggregate = null;
    }

    public TeamAggregate getAggregate()
    {
        if(aggregate == null)
            aggregate = TeamAggregate.of(problems, penalty);
        return aggregate;
    }
}
