package edu.bistu.scoreboard.board;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One row of a scoreboard snapshot.
 */
@Data
@AllArgsConstructor
public class RankingEntry
{
    private final String team;
    private final int rank;
    private final int solvedCount;
    private final int penaltyTime;
    private final List<ProblemView> problems;
}
