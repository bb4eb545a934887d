package com.ryuqq.timeguard.testkit.work;

import com.ryuqq.timeguard.core.exception.ClassifiedScanException;
import com.ryuqq.timeguard.core.model.WorkInput;
import com.ryuqq.timeguard.core.work.AnalysisResult;
import com.ryuqq.timeguard.core.work.Finding;
import com.ryuqq.timeguard.core.work.Severity;
import com.ryuqq.timeguard.core.work.WorkFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * Work function driven by a script carried in the work input.
 *
 * <p>The same script behaves identically inline and inside a child JVM, which lets one contract
 * suite exercise both coordinators. Directives are separated by {@code ;} and run in order:</p>
 *
 * <ul>
 *   <li>{@code sleep <ms>} - blocking sleep (interruptible)</li>
 *   <li>{@code spin <ms>} - busy loop that ignores interrupts</li>
 *   <li>{@code print <text>} - write a line to stdout</li>
 *   <li>{@code print-partial <text>} - write to stdout without a line break</li>
 *   <li>{@code finding <ruleId>} - add a WARNING finding to the result</li>
 *   <li>{@code fail [message]} - throw IllegalStateException</li>
 *   <li>{@code fail-checked [message]} - throw a checked Exception</li>
 *   <li>{@code fail-classified-timeout <ms>} - throw a pre-classified timeout</li>
 *   <li>{@code fail-classified-error <message>} - throw a pre-classified error</li>
 *   <li>{@code fail-error <message>} - throw StackOverflowError</li>
 *   <li>{@code return-null} - return no result</li>
 *   <li>{@code exit <code>} - halt the JVM immediately (isolated mode only)</li>
 *   <li>{@code ok} - return the result collected so far</li>
 * </ul>
 *
 * <p>A script that runs out of directives returns the collected result. An empty script returns a
 * clean result.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public class ScriptedWork implements WorkFunction {

    /**
     * Public no-arg constructor, required for isolated mode.
     */
    public ScriptedWork() {
    }

    /**
     * Joins directives into a script.
     *
     * @param directives directives in execution order
     * @return work input carrying the script
     */
    public static WorkInput script(String... directives) {
        return WorkInput.of(String.join("; ", directives));
    }

    @Override
    public AnalysisResult analyze(WorkInput input) throws Exception {
        List<Finding> findings = new ArrayList<>();
        if (input == null || input.isEmpty()) {
            return AnalysisResult.clean();
        }

        for (String raw : input.getValue().split(";")) {
            String directive = raw.trim();
            if (directive.isEmpty()) {
                continue;
            }
            int space = directive.indexOf(' ');
            String name = space < 0 ? directive : directive.substring(0, space);
            String argument = space < 0 ? "" : directive.substring(space + 1).trim();

            switch (name) {
                case "sleep" -> Thread.sleep(Long.parseLong(argument));
                case "spin" -> spin(Long.parseLong(argument));
                case "print" -> System.out.println(argument);
                case "print-partial" -> {
                    System.out.print(argument);
                    System.out.flush();
                }
                case "finding" -> findings.add(Finding.of(argument, Severity.WARNING, "Scripted finding"));
                case "fail" -> throw new IllegalStateException(argument.isEmpty() ? null : argument);
                case "fail-checked" -> throw new Exception(argument.isEmpty() ? null : argument);
                case "fail-classified-timeout" -> {
                    long timeoutMs = Long.parseLong(argument);
                    throw ClassifiedScanException.timeout(
                        "Scan exceeded maximum execution time of " + timeoutMs + "ms", timeoutMs);
                }
                case "fail-classified-error" -> throw ClassifiedScanException.error(argument);
                case "fail-error" -> throw new StackOverflowError(argument);
                case "return-null" -> {
                    return null;
                }
                case "exit" -> Runtime.getRuntime().halt(Integer.parseInt(argument));
                case "ok" -> {
                    return AnalysisResult.completed(findings);
                }
                default -> throw new IllegalArgumentException("Unknown directive: " + directive);
            }
        }
        return AnalysisResult.completed(findings);
    }

    private static void spin(long millis) {
        long until = System.nanoTime() + millis * 1_000_000L;
        while (System.nanoTime() < until) {
            Thread.onSpinWait();
        }
    }
}
