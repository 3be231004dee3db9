package edu.bistu.scoreboard.directive;

public enum DirectiveType
{
    ADDTEAM,
    START,
    SUBMIT,
    FLUSH,
    FREEZE,
    SCROLL,
    QUERY_RANKING,
    QUERY_SUBMISSION,
    END
}
