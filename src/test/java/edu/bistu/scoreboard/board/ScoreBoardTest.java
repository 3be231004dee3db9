package edu.bistu.scoreboard.board;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import shared.Submission;
import shared.SubmissionResult;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ScoreBoardTest
{
    @Mock
    private ScoreChangeReporter reporter;

    @Captor
    private ArgumentCaptor<List<RankingEntry>> boardCaptor;

    private ScoreBoard board;

    @BeforeEach
    void setUp()
    {
        board = new ScoreBoard(reporter);
    }

    private void startWith(int problems, String... teams)
    {
        for(String team : teams)
        {
            assertThat(board.addTeam(team).isOk()).isTrue();
        }
        assertThat(board.start(300, problems).isOk()).isTrue();
    }

    @Test
    void rejectsDuplicatedTeam()
    {
        assertThat(board.addTeam("team").isOk()).isTrue();

        assertThat(board.addTeam("team").getStatus()).isEqualTo(OperationStatus.DUPLICATED_TEAM);
        assertThat(board.getRanking()).containsExactly("team");
    }

    @Test
    void rejectsTeamsAndSecondStartAfterStart()
    {
        startWith(3, "team");

        assertThat(board.addTeam("late").getStatus()).isEqualTo(OperationStatus.COMPETITION_STARTED);
        assertThat(board.start(100, 5).getStatus()).isEqualTo(OperationStatus.COMPETITION_STARTED);
        assertThat(board.getProblemCount()).isEqualTo(3);
        assertThat(board.getDuration()).isEqualTo(300);
        assertThat(board.rankOf("late").getStatus()).isEqualTo(OperationStatus.TEAM_NOT_FOUND);
    }

    @Test
    void rejectsProblemCountOutsideConfiguredRange()
    {
        ScoreBoard small = new ScoreBoard(20, 5, reporter);

        assertThat(small.start(300, 0).getStatus()).isEqualTo(OperationStatus.INVALID_PROBLEM_COUNT);
        assertThat(small.start(300, 6).getStatus()).isEqualTo(OperationStatus.INVALID_PROBLEM_COUNT);
        assertThat(small.isStarted()).isFalse();
        assertThat(small.start(300, 5).isOk()).isTrue();
    }

    @Test
    void rejectsInvalidConstruction()
    {
        assertThatThrownBy(() -> new ScoreBoard(-1, 26, reporter)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoreBoard(20, 27, reporter)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOperationsBeforeStart()
    {
        board.addTeam("team");

        assertThat(board.submit('A', "team", SubmissionResult.Accepted, 1).getStatus())
                .isEqualTo(OperationStatus.COMPETITION_NOT_STARTED);
        assertThat(board.flush().getStatus()).isEqualTo(OperationStatus.COMPETITION_NOT_STARTED);
        assertThat(board.freeze().getStatus()).isEqualTo(OperationStatus.COMPETITION_NOT_STARTED);
        assertThat(board.scroll().getStatus()).isEqualTo(OperationStatus.COMPETITION_NOT_STARTED);
        verifyNoInteractions(reporter);
    }

    @Test
    void rejectsUnknownTeamAndProblem()
    {
        startWith(3, "team");

        assertThat(board.submit('A', "ghost", SubmissionResult.Accepted, 1).getStatus())
                .isEqualTo(OperationStatus.TEAM_NOT_FOUND);
        assertThat(board.submit('D', "team", SubmissionResult.Accepted, 1).getStatus())
                .isEqualTo(OperationStatus.PROBLEM_NOT_FOUND);
        assertThat(board.lastSubmission("team", null, null).getValue()).isNull();
    }

    @Test
    void laterSubmissionsNeverChangeSolvedProblem()
    {
        startWith(2, "team");
        board.submit('A', "team", SubmissionResult.Wrong_Answer, 3);
        board.submit('A', "team", SubmissionResult.Runtime_Error, 8);
        board.submit('A', "team", SubmissionResult.Accepted, 30);
        board.submit('A', "team", SubmissionResult.Wrong_Answer, 40);
        board.submit('A', "team", SubmissionResult.Accepted, 45);

        ProblemRecord record = board.getProblemRecord("team", 'A');
        assertThat(record.isSolved()).isTrue();
        assertThat(record.getSolveTime()).isEqualTo(30);
        assertThat(record.getWrongAttempts()).isEqualTo(2);
        assertThat(record.getSubmissions()).hasSize(5);
        assertThat(board.getAggregate("team").getPenaltyTime()).isEqualTo(70);
    }

    @Test
    void submissionsDoNotReorderRankingUntilFlush()
    {
        startWith(2, "Ann", "Bob");
        board.submit('A', "Bob", SubmissionResult.Accepted, 10);

        assertThat(board.getRanking()).containsExactly("Ann", "Bob");
        assertThat(board.rankOf("Bob").getValue().getRank()).isEqualTo(2);

        board.flush();

        assertThat(board.getRanking()).containsExactly("Bob", "Ann");
        assertThat(board.rankOf("Bob").getValue().getRank()).isEqualTo(1);
    }

    @Test
    void equalScoresRankByEarlierSolveTime()
    {
        startWith(1, "Y", "X");
        board.submit('A', "X", SubmissionResult.Wrong_Answer, 5);
        board.submit('A', "X", SubmissionResult.Accepted, 10);
        board.submit('A', "Y", SubmissionResult.Accepted, 30);

        List<RankingEntry> ranking = board.flush().getValue();

        assertThat(ranking).extracting(RankingEntry::getTeam).containsExactly("X", "Y");
        assertThat(ranking).extracting(RankingEntry::getPenaltyTime).containsExactly(30, 30);
    }

    @Test
    void equalTeamsRankByName()
    {
        startWith(2, "Zed", "Amy", "Max");
        board.submit('A', "Zed", SubmissionResult.Accepted, 10);
        board.submit('B', "Amy", SubmissionResult.Accepted, 10);

        assertThat(board.flush().getValue()).extracting(RankingEntry::getTeam).containsExactly("Amy", "Zed", "Max");
    }

    @Test
    void flushedRankingIsConsistentForEveryAdjacentPair()
    {
        String[] teams = {"t1", "t2", "t3", "t4", "t5", "t6", "t7", "t8"};
        startWith(5, teams);
        SubmissionResult[] results = SubmissionResult.values();
        Random random = new Random(20240915L);
        for(int time = 1; time <= 240; time++)
        {
            char problem = (char) ('A' + random.nextInt(5));
            String team = teams[random.nextInt(teams.length)];
            SubmissionResult result = random.nextInt(3) == 0 ? SubmissionResult.Accepted : results[random.nextInt(results.length)];
            board.submit(problem, team, result, time);
        }

        board.flush();

        RankComparator comparator = new RankComparator();
        List<String> ranking = board.getRanking();
        assertThat(ranking).containsExactlyInAnyOrder(teams);
        for(int i = 0; i + 1 < ranking.size(); i++)
        {
            assertThat(comparator.compare(board.team(ranking.get(i)), board.team(ranking.get(i + 1))))
                    .as("%s before %s", ranking.get(i), ranking.get(i + 1))
                    .isNegative();
        }
    }

    @Test
    void flushReportsSnapshot()
    {
        startWith(2, "Ann", "Bob");
        board.submit('B', "Bob", SubmissionResult.Accepted, 12);
        board.submit('A', "Ann", SubmissionResult.Wrong_Answer, 20);

        board.flush();

        verify(reporter).snapshot(eq(SnapshotKind.FLUSH), boardCaptor.capture());
        List<RankingEntry> snapshot = boardCaptor.getValue();
        assertThat(snapshot).hasSize(2);
        RankingEntry bob = snapshot.get(0);
        assertThat(bob.getTeam()).isEqualTo("Bob");
        assertThat(bob.getRank()).isEqualTo(1);
        assertThat(bob.getSolvedCount()).isEqualTo(1);
        assertThat(bob.getPenaltyTime()).isEqualTo(12);
        assertThat(bob.getProblems()).extracting(ProblemView::getState)
                .containsExactly(ProblemView.State.UNATTEMPTED, ProblemView.State.SOLVED);
        assertThat(snapshot.get(1).getProblems().get(0).getState()).isEqualTo(ProblemView.State.UNSOLVED);
    }

    @Test
    void freezeTwiceFails()
    {
        startWith(1, "team");

        assertThat(board.freeze().isOk()).isTrue();
        assertThat(board.freeze().getStatus()).isEqualTo(OperationStatus.ALREADY_FROZEN);
        assertThat(board.isFrozen()).isTrue();
    }

    @Test
    void frozenSubmissionsWaitForScroll()
    {
        startWith(2, "team");
        board.submit('A', "team", SubmissionResult.Accepted, 10);
        board.freeze();
        board.submit('A', "team", SubmissionResult.Wrong_Answer, 200);
        board.submit('B', "team", SubmissionResult.Wrong_Answer, 201);
        board.submit('B', "team", SubmissionResult.Accepted, 202);

        ProblemRecord solved = board.getProblemRecord("team", 'A');
        ProblemRecord pending = board.getProblemRecord("team", 'B');
        assertThat(solved.hasPending()).isFalse();
        assertThat(solved.getSubmissions()).hasSize(2);
        assertThat(pending.getPendingCount()).isEqualTo(2);
        assertThat(pending.isSolved()).isFalse();
        assertThat(pending.getWrongAttempts()).isZero();
        assertThat(board.getAggregate("team").getSolvedCount()).isEqualTo(1);
    }

    @Test
    void rankQueryCarriesFrozenFlag()
    {
        board.addTeam("Bob");
        board.addTeam("Ann");
        assertThat(board.rankOf("Bob").getValue().getRank()).isEqualTo(2);

        board.start(300, 1);
        board.freeze();

        RankQuery query = board.rankOf("Ann").getValue();
        assertThat(query.getRank()).isEqualTo(1);
        assertThat(query.isFrozen()).isTrue();
        assertThat(board.rankOf("Eve").getStatus()).isEqualTo(OperationStatus.TEAM_NOT_FOUND);
    }

    @Test
    void lastSubmissionPicksLatestMatch()
    {
        startWith(3, "team");
        board.submit('A', "team", SubmissionResult.Wrong_Answer, 5);
        board.submit('B', "team", SubmissionResult.Accepted, 15);
        board.submit('A', "team", SubmissionResult.Accepted, 25);
        board.submit('C', "team", SubmissionResult.Wrong_Answer, 20);

        assertThat(board.lastSubmission("team", null, null).getValue())
                .isEqualTo(new Submission('A', SubmissionResult.Accepted, 25));
        assertThat(board.lastSubmission("team", null, SubmissionResult.Wrong_Answer).getValue())
                .isEqualTo(new Submission('C', SubmissionResult.Wrong_Answer, 20));
        assertThat(board.lastSubmission("team", 'B', null).getValue())
                .isEqualTo(new Submission('B', SubmissionResult.Accepted, 15));
        assertThat(board.lastSubmission("team", 'B', SubmissionResult.Wrong_Answer).getValue()).isNull();
        assertThat(board.lastSubmission("ghost", null, null).getStatus()).isEqualTo(OperationStatus.TEAM_NOT_FOUND);
    }

    @Test
    void lastSubmissionIncludesFrozenSubmissions()
    {
        startWith(1, "team");
        board.freeze();
        board.submit('A', "team", SubmissionResult.Time_Limit_Exceed, 250);

        Reply<Submission> reply = board.lastSubmission("team", 'A', null);

        assertThat(reply.isOk()).isTrue();
        assertThat(reply.getValue().getResult()).isEqualTo(SubmissionResult.Time_Limit_Exceed);
    }

    @Test
    void lastSubmissionKeepsFirstOfEqualTimes()
    {
        startWith(2, "team");
        board.submit('B', "team", SubmissionResult.Wrong_Answer, 10);
        board.submit('A', "team", SubmissionResult.Runtime_Error, 10);

        assertThat(board.lastSubmission("team", null, null).getValue().getProblem()).isEqualTo('A');
    }

    @Test
    void penaltyIsConfigurable()
    {
        board = new ScoreBoard(5, 26, reporter);
        startWith(1, "team");
        board.submit('A', "team", SubmissionResult.Wrong_Answer, 1);
        board.submit('A', "team", SubmissionResult.Accepted, 10);

        assertThat(board.getAggregate("team").getPenaltyTime()).isEqualTo(15);
    }
}
