package edu.bistu.scoreboard.node;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import edu.bistu.scoreboard.board.RankChange;
import edu.bistu.scoreboard.board.RankingEntry;
import edu.bistu.scoreboard.board.ScoreChangeReporter;
import edu.bistu.scoreboard.board.SnapshotKind;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes every snapshot and rank change as one JSON object per line.
 */
@Slf4j
public class JsonLinesReporter implements ScoreChangeReporter, Closeable
{
    private final Writer writer;
    private final Gson gson = new Gson();

    public JsonLinesReporter(Writer writer)
    {
        this.writer = writer;
    }

    @Override
    public void snapshot(SnapshotKind kind, List<RankingEntry> ranking)
    {
        JsonObject event = new JsonObject();
        event.addProperty("type", "snapshot");
        event.addProperty("kind", kind.name());
        event.add("ranking", gson.toJsonTree(ranking));
        write(event);
    }

    @Override
    public void rankChanged(RankChange change)
    {
        JsonObject event = gson.toJsonTree(change).getAsJsonObject();
        event.addProperty("type", "rank_change");
        write(event);
    }

    private void write(JsonObject event)
    {
        try
        {
            writer.write(gson.toJson(event));
            writer.write('\n');
            writer.flush();
        }
        catch (IOException e)
        {
            log.error("failed to export " + event.get("type").getAsString() + " event");
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() throws IOException
    {
        writer.close();
    }
}
