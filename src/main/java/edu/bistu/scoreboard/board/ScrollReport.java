package edu.bistu.scoreboard.board;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ScrollReport
{
    private final List<RankingEntry> frozenBoard;
    private final List<RankChange> changes;
    private final List<RankingEntry> finalBoard;
}
