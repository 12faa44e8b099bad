package io.backup4j.core.exception;

public class CronValidationException extends BackupException {

    private final String expression;

    public CronValidationException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public CronValidationException(String expression, String reason, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
