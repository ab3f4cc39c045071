package com.trendearly.pipeline.runner;

import com.trendearly.pipeline.dto.PipelineRunReport;
import com.trendearly.pipeline.service.DailyPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * One-shot entry point: {@code run [--date=YYYY-MM-DD] [--max-keywords=N]}.
 *
 * <p>Without the {@code run} command the application keeps running for the scheduler.
 * Exit codes: 0 run finished, 1 run failed, 2 invalid arguments.</p>
 */
@Slf4j
@Component
public class PipelineCommandRunner implements ApplicationRunner {

    public static final String COMMAND = "run";
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "usage: run [--date=YYYY-MM-DD] [--max-keywords=N]";

    private final DailyPipelineService pipelineService;
    private final ApplicationContext context;
    private final Clock clock;

    public PipelineCommandRunner(DailyPipelineService pipelineService, ApplicationContext context, Clock clock) {
        this.pipelineService = pipelineService;
        this.context = context;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.getNonOptionArgs().isEmpty()) {
            return;
        }
        int exitCode = execute(args);
        log.info("[Pipeline] cli exit. exitCode={}", exitCode);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    int execute(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.size() != 1 || !COMMAND.equals(commands.get(0))) {
            log.error("[Pipeline] unknown command {}. {}", commands, USAGE);
            return EXIT_USAGE;
        }

        LocalDate date;
        Integer maxKeywords;
        try {
            date = parseDate(args);
            maxKeywords = parseMaxKeywords(args);
        } catch (IllegalArgumentException e) {
            log.error("[Pipeline] {}. {}", e.getMessage(), USAGE);
            return EXIT_USAGE;
        }

        PipelineRunReport report = maxKeywords == null
                ? pipelineService.run(date)
                : pipelineService.run(date, maxKeywords);
        return report.failed() ? EXIT_FAILED : EXIT_OK;
    }

    private LocalDate parseDate(ApplicationArguments args) {
        String value = singleOption(args, "date");
        if (value == null) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid --date '" + value + "'", e);
        }
    }

    private Integer parseMaxKeywords(ApplicationArguments args) {
        String value = singleOption(args, "max-keywords");
        if (value == null) {
            return null;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid --max-keywords '" + value + "'", e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException("--max-keywords must be positive");
        }
        return parsed;
    }

    private static String singleOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + name + " needs exactly one value");
        }
        return values.get(0);
    }
}
