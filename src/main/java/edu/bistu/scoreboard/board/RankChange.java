package edu.bistu.scoreboard.board;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A team moving up during a scroll, reported once per reveal that changed its position.
 */
@Data
@AllArgsConstructor
public class RankChange
{
    private final String team;

    //the team now directly below the moved one
    private final String overtaken;

    private final int solvedCount;
    private final int penaltyTime;
}
