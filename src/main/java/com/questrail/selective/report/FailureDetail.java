package com.questrail.selective.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Details of a failed test block, captured when the harness reports the
 * throwable that ended it.
 *
 * @param module         the block's module
 * @param testName       the block's name
 * @param line           source line of the block
 * @param exceptionType  fully qualified class of the throwable
 * @param message        the throwable's message, or empty
 * @param file           source file of the throw site, or empty if unknown
 * @param throwLine      line of the throw site, or -1 if unknown
 * @param trace          stack frames below the throw site, up to the run loop
 * @param traceTruncated {@code true} if frames of the run loop and its callers
 *                       were left out
 */
public record FailureDetail(
        String module,
        String testName,
        int line,
        String exceptionType,
        String message,
        String file,
        int throwLine,
        List<String> trace,
        boolean traceTruncated
) {
    /**
     * Frames from this class down belong to the run loop, not the block.
     */
    static final String RUN_LOOP_CLASS = "com.questrail.selective.runtime.SelectiveTestRun";

    public FailureDetail {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(testName, "testName");
        Objects.requireNonNull(exceptionType, "exceptionType");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(file, "file");
        trace = List.copyOf(trace);
    }

    /**
     * Captures the failure of {@code testName} from its throwable.
     */
    public static FailureDetail of(String module, String testName, int line, Throwable cause) {
        Objects.requireNonNull(cause, "cause");

        String file = "";
        int throwLine = -1;
        StackTraceElement[] frames = cause.getStackTrace();
        if (frames.length > 0) {
            file = frames[0].getFileName() != null ? frames[0].getFileName() : "";
            throwLine = frames[0].getLineNumber();
        }

        List<String> trace = new ArrayList<>();
        boolean truncated = false;
        for (int i = 1; i < frames.length; i++) {
            if (isRunLoop(frames[i].getClassName())) {
                truncated = true;
                break;
            }
            trace.add(frames[i].toString());
        }

        return new FailureDetail(
                module,
                testName,
                line,
                cause.getClass().getName(),
                cause.getMessage() != null ? cause.getMessage() : "",
                file,
                throwLine,
                trace,
                truncated);
    }

    private static boolean isRunLoop(String className) {
        return className.equals(RUN_LOOP_CLASS) || className.startsWith(RUN_LOOP_CLASS + "$");
    }
}
