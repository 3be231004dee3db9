package edu.bistu.scoreboard.board;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RankQuery
{
    private final String team;

    //1-based
    private final int rank;

    //the rank may not reflect frozen results yet
    private final boolean frozen;
}
