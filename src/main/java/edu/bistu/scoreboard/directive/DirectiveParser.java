package edu.bistu.scoreboard.directive;

import shared.SubmissionResult;

/**
 * Turns one line of the contest feed into a {@link Directive}.
 * <pre>
 * ADDTEAM team
 * START DURATION 300 PROBLEM 10
 * SUBMIT A BY team WITH Accepted AT 12
 * FLUSH | FREEZE | SCROLL | END
 * QUERY_RANKING team
 * QUERY_SUBMISSION team WHERE PROBLEM=A AND STATUS=ALL
 * </pre>
 */
public class DirectiveParser
{
    private static final String ALL = "ALL";

    public Directive parse(String line) throws MalformedDirectiveException
    {
        String[] tokens = line.trim().split("\\s+");
        if(tokens.length == 0 || tokens[0].isEmpty())
            throw new MalformedDirectiveException(line, "empty line");

        DirectiveType type;
        try
        {
            type = DirectiveType.valueOf(tokens[0]);
        }
        catch (IllegalArgumentException e)
        {
            throw new MalformedDirectiveException(line, "unknown command " + tokens[0]);
        }

        Directive directive = new Directive(type);
        switch (type)
        {
            case ADDTEAM:
            case QUERY_RANKING:
                expectLength(line, tokens, 2);
                directive.setTeam(tokens[1]);
                break;
            case START:
                expectLength(line, tokens, 5);
                expectKeyword(line, tokens[1], "DURATION");
                expectKeyword(line, tokens[3], "PROBLEM");
                directive.setDuration(parseInt(line, tokens[2]));
                directive.setProblemCount(parseInt(line, tokens[4]));
                break;
            case SUBMIT:
                expectLength(line, tokens, 8);
                expectKeyword(line, tokens[2], "BY");
                expectKeyword(line, tokens[4], "WITH");
                expectKeyword(line, tokens[6], "AT");
                directive.setProblem(parseProblem(line, tokens[1]));
                directive.setTeam(tokens[3]);
                directive.setResult(parseResult(line, tokens[5]));
                directive.setTime(parseInt(line, tokens[7]));
                break;
            case QUERY_SUBMISSION:
                expectLength(line, tokens, 6);
                expectKeyword(line, tokens[2], "WHERE");
                expectKeyword(line, tokens[4], "AND");
                directive.setTeam(tokens[1]);
                String problem = valueOf(line, tokens[3], "PROBLEM=");
                String status = valueOf(line, tokens[5], "STATUS=");
                directive.setProblem(ALL.equals(problem) ? null : parseProblem(line, problem));
                directive.setResult(ALL.equals(status) ? null : parseResult(line, status));
                break;
            default:
                expectLength(line, tokens, 1);
                break;
        }
        return directive;
    }

    private void expectLength(String line, String[] tokens, int length) throws MalformedDirectiveException
    {
        if(tokens.length != length)
            throw new MalformedDirectiveException(line, "expected " + length + " tokens but got " + tokens.length);
    }

    private void expectKeyword(String line, String token, String keyword) throws MalformedDirectiveException
    {
        if(!token.equals(keyword))
            throw new MalformedDirectiveException(line, "expected " + keyword + " but got " + token);
    }

    private String valueOf(String line, String token, String prefix) throws MalformedDirectiveException
    {
        if(!token.startsWith(prefix) || token.length() == prefix.length())
            throw new MalformedDirectiveException(line, "expected " + prefix + "<value> but got " + token);
        return token.substring(prefix.length());
    }

    private int parseInt(String line, String token) throws MalformedDirectiveException
    {
        try
        {
            return Integer.parseInt(token);
        }
        catch (NumberFormatException e)
        {
            throw new MalformedDirectiveException(line, "not a number: " + token);
        }
    }

    private char parseProblem(String line, String token) throws MalformedDirectiveException
    {
        if(token.length() != 1 || token.charAt(0) < 'A' || token.charAt(0) > 'Z')
            throw new MalformedDirectiveException(line, "not a problem: " + token);
        return token.charAt(0);
    }

    private SubmissionResult parseResult(String line, String token) throws MalformedDirectiveException
    {
        SubmissionResult result = SubmissionResult.of(token);
        if(result == null)
            throw new MalformedDirectiveException(line, "unknown status: " + token);
        return result;
    }
}
