package edu.bistu.scoreboard.board;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import shared.Submission;
import shared.SubmissionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Contest scoreboard with freeze and scroll.
 * <p>
 * Submissions only change team state; the ranking is materialized on {@link #flush()}
 * and maintained incrementally during {@link #scroll()}. Every operation validates its
 * input before touching state and reports expected failures through {@link Reply}.
 * Not thread safe, all calls must come from one thread in event order.
 */
@Slf4j
public class ScoreBoard
{
    public static final int DEFAULT_PENALTY = 20;
    public static final int MAX_PROBLEM = 26;

    private final Map<String, Team> teams = new HashMap<>();

    //team names, best first
    private final List<String> ranking = new ArrayList<>();

    private final RankComparator rankComparator = new RankComparator();
    private final Comparator<String> rankOrder;

    private final ScoreChangeReporter reporter;
    private final int penalty;
    private final int maxProblem;

    @Getter
    private boolean started;

    @Getter
    private boolean frozen;

    @Getter
    private boolean ended;

    @Getter
    private int duration;

    @Getter
    private int problemCount;

    public ScoreBoard(ScoreChangeReporter reporter)
    {
        this(DEFAULT_PENALTY, MAX_PROBLEM, reporter);
    }

    public ScoreBoard(int penalty, int maxProblem, ScoreChangeReporter reporter)
    {
        if(penalty < 0)
            throw new IllegalArgumentException("penalty must not be negative: " + penalty);
        if(maxProblem < 1 || maxProblem > MAX_PROBLEM)
            throw new IllegalArgumentException("max problem must be between 1 and " + MAX_PROBLEM + ": " + maxProblem);
        this.penalty = penalty;
        this.maxProblem = maxProblem;
        this.reporter = reporter;
        this.rankOrder = (name1, name2) -> rankComparator.compare(teams.get(name1), teams.get(name2));
    }

    public Reply<Void> addTeam(String name)
    {
        if(started)
            return Reply.fail(OperationStatus.COMPETITION_STARTED);
        if(teams.containsKey(name))
            return Reply.fail(OperationStatus.DUPLICATED_TEAM);

        teams.put(name, new Team(name, penalty));
        //nobody has solved anything yet, so name order is rank order
        int index = Collections.binarySearch(ranking, name);
        ranking.add(-index - 1, name);
        log.info("team " + name + " added, " + teams.size() + " teams in total");
        return Reply.ok();
    }

    public Reply<Void> start(int duration, int problemCount)
    {
        if(started)
            return Reply.fail(OperationStatus.COMPETITION_STARTED);
        if(problemCount < 1 || problemCount > maxProblem)
            return Reply.fail(OperationStatus.INVALID_PROBLEM_COUNT);

        started = true;
        this.duration = duration;
        this.problemCount = problemCount;
        for(Team team : teams.values())
        {
            team.openProblems(problemCount);
        }
        log.info("competition started, duration: " + duration + ", problems: " + problemCount + ", teams: " + teams.size());
        return Reply.ok();
    }

    public Reply<Void> submit(char problem, String teamName, SubmissionResult result, int time)
    {
        if(!started)
            return Reply.fail(OperationStatus.COMPETITION_NOT_STARTED);
        Team team = teams.get(teamName);
        if(team == null)
            return Reply.fail(OperationStatus.TEAM_NOT_FOUND);
        ProblemRecord record = team.getProblem(problem);
        if(record == null)
            return Reply.fail(OperationStatus.PROBLEM_NOT_FOUND);

        Submission submission = new Submission(problem, result, time);
        record.record(submission);

        if(record.isSolved())
        {
            log.debug(teamName + " submitted to solved problem " + problem + ", kept for audit only");
        }
        else if(frozen)
        {
            record.hold(submission);
            log.debug(teamName + " " + submission + " held until scroll");
        }
        else
        {
            record.apply(submission);
            team.invalidate();
            log.debug(teamName + " " + submission + " applied");
        }
        return Reply.ok();
    }

    public Reply<List<RankingEntry>> flush()
    {
        if(!started)
            return Reply.fail(OperationStatus.COMPETITION_NOT_STARTED);

        sortRanking();
        List<RankingEntry> board = snapshot();
        reporter.snapshot(SnapshotKind.FLUSH, board);
        log.info("scoreboard flushed");
        return Reply.ok(board);
    }

    public Reply<Void> freeze()
    {
        if(!started)
            return Reply.fail(OperationStatus.COMPETITION_NOT_STARTED);
        if(frozen)
            return Reply.fail(OperationStatus.ALREADY_FROZEN);

        frozen = true;
        log.info("scoreboard frozen");
        return Reply.ok();
    }

    /**
     * Reveals every frozen submission, one problem at a time. Each round picks the
     * lowest ranked team holding frozen submissions and its smallest such problem;
     * a team that solves it moves up past every team it now beats.
     */
    public Reply<ScrollReport> scroll()
    {
        if(!started)
            return Reply.fail(OperationStatus.COMPETITION_NOT_STARTED);
        if(!frozen)
            return Reply.fail(OperationStatus.NOT_FROZEN);

        log.info("scrolling scoreboard");
        sortRanking();
        List<RankingEntry> frozenBoard = snapshot();
        reporter.snapshot(SnapshotKind.SCROLL_FROZEN, frozenBoard);

        List<RankChange> changes = new ArrayList<>();
        int reveals = 0;
        while(true)
        {
            Team target = null;
            ProblemRecord record = null;
            int oldRank = -1;
            for(int i = ranking.size() - 1; i >= 0; i--)
            {
                Team team = teams.get(ranking.get(i));
                ProblemRecord pending = team.firstPendingProblem();
                if(pending != null)
                {
                    target = team;
                    record = pending;
                    oldRank = i;
                    break;
                }
            }
            if(target == null)
                break;

            reveals++;
            boolean solvedNow = record.reveal();
            target.invalidate();
            log.debug("revealed " + target.getName() + " problem " + record.getProblem() + ", solved: " + solvedNow);
            if(!solvedNow)
                continue;

            int newRank = oldRank;
            while(newRank > 0 && rankComparator.compare(target, teams.get(ranking.get(newRank - 1))) < 0)
            {
                newRank--;
            }
            if(newRank < oldRank)
            {
                ranking.remove(oldRank);
                ranking.add(newRank, target.getName());
                TeamAggregate aggregate = target.getAggregate();
                RankChange change = new RankChange(target.getName(), ranking.get(newRank + 1),
                        aggregate.getSolvedCount(), aggregate.getPenaltyTime());
                changes.add(change);
                reporter.rankChanged(change);
                log.debug(target.getName() + " moved from " + (oldRank + 1) + " to " + (newRank + 1));
            }
        }

        frozen = false;
        List<RankingEntry> finalBoard = snapshot();
        reporter.snapshot(SnapshotKind.SCROLL_FINAL, finalBoard);
        log.info("scroll finished, " + reveals + " problems revealed, " + changes.size() + " rank changes");
        return Reply.ok(new ScrollReport(frozenBoard, changes, finalBoard));
    }

    public Reply<RankQuery> rankOf(String teamName)
    {
        if(!teams.containsKey(teamName))
            return Reply.fail(OperationStatus.TEAM_NOT_FOUND);
        return Reply.ok(new RankQuery(teamName, ranking.indexOf(teamName) + 1, frozen));
    }

    /**
     * Finds the latest submission of a team. Frozen submissions count whether revealed or not.
     *
     * @param problem problem to match, null for all
     * @param result  result to match, null for all
     * @return a successful reply without value when nothing matches
     */
    public Reply<Submission> lastSubmission(String teamName, Character problem, SubmissionResult result)
    {
        Team team = teams.get(teamName);
        if(team == null)
            return Reply.fail(OperationStatus.TEAM_NOT_FOUND);

        Submission last = null;
        for(ProblemRecord record : team.getProblems())
        {
            if(problem != null && record.getProblem() != problem)
                continue;
            for(Submission submission : record.getSubmissions())
            {
                if(result != null && submission.getResult() != result)
                    continue;
                if(last == null || submission.getTime() > last.getTime())
                    last = submission;
            }
        }
        return Reply.ok(last);
    }

    public Reply<Void> end()
    {
        ended = true;
        log.info("competition ended");
        return Reply.ok();
    }

    /**
     * @return the current ranking as rows, without re-sorting
     */
    public List<RankingEntry> snapshot()
    {
        List<RankingEntry> board = new ArrayList<>(ranking.size());
        for(int i = 0; i < ranking.size(); i++)
        {
            Team team = teams.get(ranking.get(i));
            TeamAggregate aggregate = team.getAggregate();
            List<ProblemView> problems = new ArrayList<>(team.getProblems().size());
            for(ProblemRecord record : team.getProblems())
            {
                problems.add(ProblemView.of(record, frozen));
            }
            board.add(new RankingEntry(team.getName(), i + 1, aggregate.getSolvedCount(),
                    aggregate.getPenaltyTime(), Collections.unmodifiableList(problems)));
        }
        return Collections.unmodifiableList(board);
    }

    public List<String> getRanking()
    {
        return Collections.unmodifiableList(ranking);
    }

    /**
     * @return the record of a team on a problem, or null if either is unknown
     */
    public ProblemRecord getProblemRecord(String teamName, char problem)
    {
        Team team = teams.get(teamName);
        return team == null ? null : team.getProblem(problem);
    }

    public TeamAggregate getAggregate(String teamName)
    {
        Team team = teams.get(teamName);
        return team == null ? null : team.getAggregate();
    }

    Team team(String teamName)
    {
        return teams.get(teamName);
    }

    private void sortRanking()
    {
        ranking.clear();
        ranking.addAll(teams.keySet());
        ranking.sort(rankOrder);
    }
}
