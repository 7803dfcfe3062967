package com.rmatrix;

import com.rmatrix.batch.BatchResult;
import com.rmatrix.batch.RuleBatchProcessor;
import com.rmatrix.config.RmatrixConfig;
import com.rmatrix.output.BatchOutputWriter;
import com.rmatrix.rule.RuleConversion;
import com.rmatrix.spring.EnableRmatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point.
 * <p>
 * With arguments, the non-option arguments are joined into one rule line and
 * its equations are printed:
 * <pre>
 * java -jar rmatrix.jar b0001 '(NOT(ArcA OR Fnr))'
 * </pre>
 * Without arguments, the rules file configured under {@code batch.rules} is
 * converted and written in the configured format.
 */
@SpringBootApplication
@EnableRmatrix
public class RmatrixApplication {

    private static final Logger log = LoggerFactory.getLogger(RmatrixApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RmatrixApplication.class, args);
    }

    @Bean
    public CommandLineRunner convert(RuleBatchProcessor processor, BatchOutputWriter outputWriter,
                                     RmatrixConfig config) {
        return args -> {
            List<String> ruleArgs = Arrays.stream(args)
                    .filter(arg -> !arg.startsWith("--"))
                    .toList();

            if (!ruleArgs.isEmpty()) {
                RuleConversion conversion = processor.convertLine(String.join(" ", ruleArgs));
                log.info("Converted rule for {}: {}", conversion.target(), conversion.dnf());
                outputWriter.write(new BatchResult(List.of(conversion), List.of()));
                return;
            }

            String rules = config.batch().rulesPath();
            if (rules == null) {
                log.warn("No rule given and no batch.rules configured in {}; nothing to convert", config.name());
                return;
            }

            BatchResult result = processor.process(rules);
            outputWriter.write(result);
            if (result.hasFailures()) {
                log.warn("{} rule(s) failed to convert", result.failures().size());
            }
        };
    }
}
