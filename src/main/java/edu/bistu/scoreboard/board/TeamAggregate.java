package edu.bistu.scoreboard.board;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Data
@AllArgsConstructor
public class TeamAggregate
{
    private final int solvedCount;
    private final int penaltyTime;

    //latest first
    private final List<Integer> solveTimes;

    public static TeamAggregate of(Collection<ProblemRecord> problems, int penalty)
    {
        int solved = 0;
        int penaltyTime = 0;
        List<Integer> times = new ArrayList<>();
        for(ProblemRecord record : problems)
        {
            if(!record.isSolved())
                continue;
            solved++;
            penaltyTime += record.getSolveTime() + penalty * record.getWrongAttempts();
            times.add(record.getSolveTime());
        }
        times.sort(Collections.reverseOrder());
        return new TeamAggregate(solved, penaltyTime, Collections.unmodifiableList(times));
    }
}
