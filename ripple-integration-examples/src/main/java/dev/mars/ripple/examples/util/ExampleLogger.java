/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ripple.examples.util;

import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console output for the Ripple examples, mirrored to java.util.logging.
 *
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.header("Funds Transfer Workflow");
 * log.step(1, "Registering handlers...");
 * log.success("Workflow registered");
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExampleLogger {

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_INFO = "•";
    private static final String INDENT = "   ";

    private final Logger logger;
    private final PrintStream out;
    private final PrintStream err;

    private ExampleLogger(Class<?> clazz, PrintStream out, PrintStream err) {
        this.logger = Logger.getLogger(clazz.getName());
        this.out = out;
        this.err = err;
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz, System.out, System.err);
    }

    public void header(String title) {
        out.println();
        out.println("=== Ripple " + title + " ===");
        logger.info("Starting: " + title);
    }

    public void step(int stepNumber, String description) {
        out.println(stepNumber + ". " + description);
        logger.info("Step " + stepNumber + ": " + description);
    }

    public void detail(String message) {
        out.println(INDENT + message);
        logger.fine(message);
    }

    public void keyValue(String key, Object value) {
        out.println(INDENT + key + ": " + value);
        logger.fine(key + "=" + value);
    }

    public void bullet(String message) {
        out.println(INDENT + SYMBOL_INFO + " " + message);
        logger.fine(message);
    }

    public void success(String message) {
        out.println(INDENT + SYMBOL_SUCCESS + " " + message);
        logger.info("SUCCESS: " + message);
    }

    /**
     * A failure the example provokes on purpose, e.g. to drive the error handler.
     */
    public void expectedFailure(String message) {
        out.println(INDENT + SYMBOL_SUCCESS + " EXPECTED: " + message);
        logger.info("EXPECTED FAILURE: " + message);
    }

    public void unexpectedError(String context, Throwable t) {
        err.println();
        err.println("UNEXPECTED ERROR occurred during " + context + ":");
        err.println("Error: " + t.getMessage());
        logger.log(Level.SEVERE, "Unexpected error in " + context, t);
    }

    public void exampleComplete(String exampleName) {
        out.println();
        out.println("=== " + exampleName + " completed successfully! ===");
        logger.info("Example completed: " + exampleName);
    }
}
