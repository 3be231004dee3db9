package edu.bistu.scoreboard.board;

import java.util.List;

/**
 * Receives what the board publishes: full snapshots on flush and scroll, and
 * every rank change made while scrolling.
 */
public interface ScoreChangeReporter
{
    void snapshot(SnapshotKind kind, List<RankingEntry> ranking);

    void rankChanged(RankChange change);

    static ScoreChangeReporter silent()
    {
        return new ScoreChangeReporter()
        {
            @Override
            public void snapshot(SnapshotKind kind, List<RankingEntry> ranking)
            {
            }

            @Override
            public void rankChanged(RankChange change)
            {
            }
        };
    }
}
