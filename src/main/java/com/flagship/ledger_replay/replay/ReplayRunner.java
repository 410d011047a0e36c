package com.flagship.ledger_replay.replay;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry: {@code ledger-replay <transactions.csv>}.
 *
 * Accounts go to stdout, warnings and errors to stderr (see logback-spring.xml).
 * Exit code is 0 on success, 2 on a usage error and 1 on any other fatal error.
 * Spring options such as {@code --replay.output.sort-by-client=false} are not
 * counted as arguments.
 */
@Component
@ConditionalOnProperty(name = "replay.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReplayRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ReplayService replayService;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        exitCode = run(args.getNonOptionArgs(), stdout);
    }

    int run(List<String> arguments, Writer output) {
        try {
            if (arguments.size() != 1) {
                throw new ReplayException(ReplayErrorCode.USAGE,
                        String.format("Command line usage error: expected exactly one input file, got %d",
                                arguments.size()));
            }
            replayService.replay(Path.of(arguments.get(0)), output);
            return 0;
        } catch (ReplayException e) {
            log.error("Replay aborted [{}]: {}", e.getErrorCode(), e.getMessage());
            return e.getErrorCode().getExitCode();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
