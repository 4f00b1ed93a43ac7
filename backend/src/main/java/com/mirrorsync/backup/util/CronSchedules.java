package com.mirrorsync.backup.util;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.mirrorsync.backup.service.InvalidScheduleException;

/**
 * Parses five-field crontab expressions (minute, hour, day-of-month, month, day-of-week).
 */
public final class CronSchedules {
    private static final CronDefinition UNIX = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    private CronSchedules() {
    }

    /**
     * @throws InvalidScheduleException if the expression is blank or not a valid crontab expression
     */
    public static ExecutionTime parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression must not be empty", null);
        }
        try {
            Cron cron = new CronParser(UNIX).parse(expression.trim());
            cron.validate();
            return ExecutionTime.forCron(cron);
        } catch (RuntimeException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }
}
