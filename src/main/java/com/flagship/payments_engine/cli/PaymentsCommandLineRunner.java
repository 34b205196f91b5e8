package com.flagship.payments_engine.cli;

import com.flagship.payments_engine.engine.EngineFailedException;
import com.flagship.payments_engine.processor.PaymentsProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line surface: {@code payments-engine <transactions.csv>}.
 *
 * Account CSV goes to stdout, diagnostics to stderr. The exit code is
 * 0 on success and 1 on bad usage, I/O failure or a failed engine; it is
 * reported to Spring Boot through {@link ExitCodeGenerator}.
 */
@Component
@ConditionalOnProperty(name = "engine.cli.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PaymentsCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final PaymentsProcessor processor;
    private final OutputStream stdout;
    private final PrintStream stderr;

    private int exitCode = EXIT_OK;

    @Autowired
    public PaymentsCommandLineRunner(PaymentsProcessor processor) {
        this(processor, System.out, System.err);
    }

    PaymentsCommandLineRunner(PaymentsProcessor processor, OutputStream stdout, PrintStream stderr) {
        this.processor = processor;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() != 1) {
            stderr.println("Usage: payments-engine <transactions.csv>");
            exitCode = EXIT_FAILURE;
            return;
        }

        Path input = Path.of(positional.get(0));
        try {
            Writer out = new BufferedWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
            processor.run(input, out);
            out.flush();
            exitCode = EXIT_OK;
        } catch (IOException e) {
            log.error("I/O failure processing {}: {}", input, e.toString());
            exitCode = EXIT_FAILURE;
        } catch (EngineFailedException e) {
            log.error("Engine failed processing {}: {}", input, e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while processing {}", input);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
