package edu.bistu.scoreboard.node.config;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import edu.bistu.scoreboard.board.ScoreBoard;
import lombok.Data;

@Data
@JacksonXmlRootElement(localName = "scoreboard")
public class ScoreBoardConfig
{
    //minutes added per wrong attempt on a solved problem
    @JacksonXmlProperty(localName = "penalty")
    private Integer penalty = ScoreBoard.DEFAULT_PENALTY;

    @JacksonXmlProperty(localName = "maxproblem")
    private Integer maxProblem = ScoreBoard.MAX_PROBLEM;

    //JSON lines file receiving snapshots and rank changes, disabled when empty
    @JacksonXmlProperty(localName = "export")
    private String export;

    /**
     * @return a description of the first invalid value, or null if the config is usable
     */
    public String validate()
    {
        if(penalty == null || penalty < 0)
            return "penalty must be a non-negative number of minutes";
        if(maxProblem == null || maxProblem < 1 || maxProblem > ScoreBoard.MAX_PROBLEM)
            return "maxproblem must be between 1 and " + ScoreBoard.MAX_PROBLEM;
        return null;
    }

    public boolean isExportEnabled()
    {
        return export != null && !export.isBlank();
    }
}
