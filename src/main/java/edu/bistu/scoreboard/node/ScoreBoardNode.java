package edu.bistu.scoreboard.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import edu.bistu.scoreboard.Referee;
import edu.bistu.scoreboard.board.ScoreBoard;
import edu.bistu.scoreboard.board.ScoreChangeReporter;
import edu.bistu.scoreboard.node.config.ScoreBoardConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

@Slf4j
public class ScoreBoardNode
{
    public static final String DEFAULT_CONFIG = "scoreboard.xml";

    public static void main(String[] args)
    {
        String configPath = null;
        String inputPath = null;
        for(int i = 0; i + 1 < args.length; i += 2)
        {
            if(args[i].equals("--config"))
                configPath = args[i + 1];
            else if(args[i].equals("--input"))
                inputPath = args[i + 1];
            else
                log.warn("unknown option " + args[i] + " ignored");
        }

        ScoreBoardConfig config = readConfig(configPath);
        if(config == null)
        {
            log.error("failed to read config");
            System.exit(1);
            return;
        }
        String invalid = config.validate();
        if(invalid != null)
        {
            log.error("invalid config: " + invalid);
            System.exit(1);
            return;
        }
        log.info("penalty: " + config.getPenalty() + ", max problem: " + config.getMaxProblem()
                + ", export: " + (config.isExportEnabled() ? config.getExport() : "disabled"));

        JsonLinesReporter exporter = null;
        try
        {
            ScoreChangeReporter reporter = ScoreChangeReporter.silent();
            if(config.isExportEnabled())
            {
                exporter = new JsonLinesReporter(new OutputStreamWriter(new FileOutputStream(config.getExport()), StandardCharsets.UTF_8));
                reporter = exporter;
            }
            ScoreBoard board = new ScoreBoard(config.getPenalty(), config.getMaxProblem(), reporter);
            InputStream in = inputPath == null ? System.in : new FileInputStream(inputPath);
            PrintStream out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)))
            {
                new Referee(board, reader, out).run();
            }
        }
        catch (IOException e)
        {
            log.error("score board node stopped", e);
            System.exit(1);
        }
        finally
        {
            if(exporter != null)
            {
                try
                {
                    exporter.close();
                }
                catch (IOException e)
                {
                    log.error("failed to close export file " + config.getExport(), e);
                }
            }
        }
        log.info("shutdown");
    }

    /**
     * Reads the config from a file, or from {@value #DEFAULT_CONFIG} on the classpath when no path is given.
     *
     * @return null if the config cannot be read
     */
    static ScoreBoardConfig readConfig(String configFilePath)
    {
        ObjectMapper mapper = new XmlMapper();
        try
        {
            if(configFilePath != null)
                return mapper.readValue(new File(configFilePath), ScoreBoardConfig.class);
            try (InputStream in = ScoreBoardNode.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG))
            {
                if(in == null)
                {
                    log.warn(DEFAULT_CONFIG + " not found on classpath, using defaults");
                    return new ScoreBoardConfig();
                }
                return mapper.readValue(in, ScoreBoardConfig.class);
            }
        }
        catch (IOException e)
        {
            log.error("cannot read config " + (configFilePath == null ? DEFAULT_CONFIG : configFilePath), e);
            return null;
        }
    }
}
