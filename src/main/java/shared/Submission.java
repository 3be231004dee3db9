package shared;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Submission
{
    private final char problem;
    private final SubmissionResult result;
    private final int time;

    @Override
    public String toString()
    {
        return problem + " " + result + " " + time;
    }
}
