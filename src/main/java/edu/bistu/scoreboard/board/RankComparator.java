package edu.bistu.scoreboard.board;

import java.util.Comparator;
import java.util.List;

/**
 * Orders teams best first: more solved problems, then less penalty time,
 * then solve times compared latest first (earlier wins), then team name.
 */
public class RankComparator implements Comparator<Team>
{
    @Override
    public int compare(Team team1, Team team2)
    {
        TeamAggregate aggregate1 = team1.getAggregate();
        TeamAggregate aggregate2 = team2.getAggregate();

        if(aggregate1.getSolvedCount() != aggregate2.getSolvedCount())
            return Integer.compare(aggregate2.getSolvedCount(), aggregate1.getSolvedCount());

        if(aggregate1.getPenaltyTime() != aggregate2.getPenaltyTime())
            return Integer.compare(aggregate1.getPenaltyTime(), aggregate2.getPenaltyTime());

        List<Integer> times1 = aggregate1.getSolveTimes();
        List<Integer> times2 = aggregate2.getSolveTimes();
        int n = Math.min(times1.size(), times2.size());
        for(int i = 0; i < n; i++)
        {
            int cmp = Integer.compare(times1.get(i), times2.get(i));
            if(cmp != 0)
                return cmp;
        }

        return team1.getName().compareTo(team2.getName());
    }
}
