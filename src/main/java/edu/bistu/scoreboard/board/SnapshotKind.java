package edu.bistu.scoreboard.board;

public enum SnapshotKind
{
    FLUSH,
    //taken at the start of a scroll, frozen results still hidden
    SCROLL_FROZEN,
    SCROLL_FINAL
}
