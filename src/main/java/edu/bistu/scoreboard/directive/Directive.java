package edu.bistu.scoreboard.directive;

import lombok.Data;
import lombok.NoArgsConstructor;
import shared.SubmissionResult;

/**
 * One parsed input line. Only the fields used by its type are set.
 */
@Data
@NoArgsConstructor
public class Directive
{
    private DirectiveType type;

    private String team;

    //SUBMIT, or QUERY_SUBMISSION filter where null means ALL
    private Character problem;
    private SubmissionResult result;

    private int time;

    //START
    private int duration;
    private int problemCount;

    public Directive(DirectiveType type)
    {
        this.type = type;
    }
}
