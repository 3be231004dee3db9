package edu.bistu.scoreboard.board;

public enum OperationStatus
{
    OK,
    DUPLICATED_TEAM,
    COMPETITION_STARTED,
    COMPETITION_NOT_STARTED,
    INVALID_PROBLEM_COUNT,
    ALREADY_FROZEN,
    NOT_FROZEN,
    TEAM_NOT_FOUND,
    PROBLEM_NOT_FOUND
}
