package shared;

public enum SubmissionResult
{
    Accepted,
    Wrong_Answer,
    Runtime_Error,
    Time_Limit_Exceed,
    Memory_Limit_Exceed,
    Compile_Error;

    public boolean isAccepted()
    {
        return this == Accepted;
    }

    /**
     * @return the result named exactly {@code name}, or null if there is none
     */
    public static SubmissionResult of(String name)
    {
        for(SubmissionResult result : values())
        {
            if(result.name().equals(name))
                return result;
        }
        return null;
    }
}
