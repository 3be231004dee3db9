package edu.bistu.scoreboard;

import edu.bistu.scoreboard.board.OperationStatus;
import edu.bistu.scoreboard.board.ProblemView;
import edu.bistu.scoreboard.board.RankChange;
import edu.bistu.scoreboard.board.RankQuery;
import edu.bistu.scoreboard.board.RankingEntry;
import edu.bistu.scoreboard.board.Reply;
import edu.bistu.scoreboard.board.ScoreBoard;
import edu.bistu.scoreboard.board.ScrollReport;
import edu.bistu.scoreboard.directive.Directive;
import edu.bistu.scoreboard.directive.DirectiveParser;
import edu.bistu.scoreboard.directive.DirectiveType;
import edu.bistu.scoreboard.directive.MalformedDirectiveException;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import shared.Submission;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Feeds the contest directives to the board one line at a time, in arrival order,
 * and prints the outcome of each.
 */
@Slf4j
public class Referee implements Runnable
{
    private final ScoreBoard board;
    private final BufferedReader input;
    private final PrintStream out;
    private final DirectiveParser parser = new DirectiveParser();

    public Referee(ScoreBoard board, BufferedReader input, PrintStream out)
    {
        this.board = board;
        this.input = input;
        this.out = out;
    }

    @Override
    public void run()
    {
        log.info("referee starts reading directives");
        int lines = 0;
        try
        {
            String line = input.readLine();
            while(line != null)
            {
                lines++;
                if(!handle(line))
                    break;
                line = input.readLine();
            }
        }
        catch (IOException e)
        {
            log.error("failed to read directive after line " + lines, e);
        }
        out.flush();
        log.info("referee stops after " + lines + " lines");
    }

    /**
     * @return false once the competition has ended and no more lines should be read
     */
    public boolean handle(String line)
    {
        if(line.isBlank())
            return true;
        Directive directive;
        try
        {
            directive = parser.parse(line);
        }
        catch (MalformedDirectiveException e)
        {
            log.warn(e.getMessage() + ", skipped");
            return true;
        }
        dispatch(directive);
        return directive.getType() != DirectiveType.END;
    }

    private void dispatch(Directive directive)
    {
        switch (directive.getType())
        {
            case ADDTEAM:
                report(board.addTeam(directive.getTeam()), "[Info]Add successfully.", "Add");
                break;
            case START:
                report(board.start(directive.getDuration(), directive.getProblemCount()), "[Info]Competition starts.", "Start");
                break;
            case SUBMIT:
                Reply<Void> submitted = board.submit(directive.getProblem(), directive.getTeam(),
                        directive.getResult(), directive.getTime());
                if(!submitted.isOk())
                    out.println("[Error]Submit failed: " + reason(submitted.getStatus()) + ".");
                break;
            case FLUSH:
                report(board.flush(), "[Info]Flush scoreboard.", "Flush");
                break;
            case FREEZE:
                report(board.freeze(), "[Info]Freeze scoreboard.", "Freeze");
                break;
            case SCROLL:
                Reply<ScrollReport> scrolled = board.scroll();
                report(scrolled, "[Info]Scroll scoreboard.", "Scroll");
                if(scrolled.isOk())
                    printScroll(scrolled.getValue());
                break;
            case QUERY_RANKING:
                queryRanking(directive.getTeam());
                break;
            case QUERY_SUBMISSION:
                querySubmission(directive);
                break;
            case END:
                report(board.end(), "[Info]Competition ends.", "End");
                break;
        }
    }

    private void report(Reply<?> reply, String success, String operation)
    {
        if(reply.isOk())
            out.println(success);
        else
            out.println("[Error]" + operation + " failed: " + reason(reply.getStatus()) + ".");
    }

    private void queryRanking(String team)
    {
        Reply<RankQuery> reply = board.rankOf(team);
        if(!reply.isOk())
        {
            out.println("[Error]Query ranking failed: " + reason(reply.getStatus()) + ".");
            return;
        }
        out.println("[Info]Complete query ranking.");
        RankQuery query = reply.getValue();
        if(query.isFrozen())
            out.println("[Warning]Scoreboard is frozen. The ranking may be inaccurate until it were scrolled.");
        out.println(query.getTeam() + " NOW AT RANKING " + query.getRank());
    }

    private void querySubmission(Directive directive)
    {
        Reply<Submission> reply = board.lastSubmission(directive.getTeam(), directive.getProblem(), directive.getResult());
        if(!reply.isOk())
        {
            out.println("[Error]Query submission failed: " + reason(reply.getStatus()) + ".");
            return;
        }
        out.println("[Info]Complete query submission.");
        Submission submission = reply.getValue();
        if(submission == null)
            out.println("Cannot find any submission.");
        else
            out.println(directive.getTeam() + " " + submission);
    }

    private void printScroll(ScrollReport report)
    {
        printBoard(report.getFrozenBoard());
        for(RankChange change : report.getChanges())
        {
            out.println(change.getTeam() + " " + change.getOvertaken() + " "
                    + change.getSolvedCount() + " " + change.getPenaltyTime());
        }
        printBoard(report.getFinalBoard());
    }

    private void printBoard(List<RankingEntry> board)
    {
        for(RankingEntry entry : board)
        {
            StringBuilder sb = new StringBuilder();
            sb.append(entry.getTeam()).append(' ')
                    .append(entry.getRank()).append(' ')
                    .append(entry.getSolvedCount()).append(' ')
                    .append(entry.getPenaltyTime());
            for(ProblemView view : entry.getProblems())
            {
                sb.append(' ').append(display(view));
            }
            out.println(sb);
        }
    }

    /**
     * Scoreboard cell: {@code .} untouched, {@code +}/{@code +2} solved, {@code -2} failed,
     * {@code 0/3} or {@code -2/3} hidden behind the freeze.
     */
    @NotNull
    static String display(ProblemView view)
    {
        int wrong = view.getWrongAttempts();
        switch (view.getState())
        {
            case HIDDEN:
                return (wrong == 0 ? "0" : "-" + wrong) + "/" + view.getPendingCount();
            case SOLVED:
                return wrong == 0 ? "+" : "+" + wrong;
            case UNSOLVED:
                return "-" + wrong;
            default:
                return ".";
        }
    }

    @NotNull
    private static String reason(OperationStatus status)
    {
        switch (status)
        {
            case DUPLICATED_TEAM:
                return "duplicated team name";
            case COMPETITION_STARTED:
                return "competition has started";
            case COMPETITION_NOT_STARTED:
                return "competition has not started";
            case INVALID_PROBLEM_COUNT:
                return "invalid problem count";
            case ALREADY_FROZEN:
                return "scoreboard has been frozen";
            case NOT_FROZEN:
                return "scoreboard has not been frozen";
            case TEAM_NOT_FOUND:
                return "cannot find the team";
            case PROBLEM_NOT_FOUND:
                return "cannot find the problem";
            default:
                return status.name().toLowerCase();
        }
    }
}
