package edu.bistu.scoreboard.directive;

public class MalformedDirectiveException extends Exception
{
    public MalformedDirectiveException(String line, String reason)
    {
        super("malformed directive \"" + line + "\": " + reason);
    }
}
