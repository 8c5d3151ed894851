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

package dev.mars.ripple.workflow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registers every workflow document found in a directory. A document that cannot be
 * parsed or fails validation is logged and skipped; the others are still registered.
 */
public class WorkflowLoader {

    private static final Logger logger = Logger.getLogger(WorkflowLoader.class.getName());

    private final WorkflowRegistry registry;
    private final List<WorkflowDefinitionParser> parsers;

    public WorkflowLoader(WorkflowRegistry registry) {
        this(registry, List.of(new JsonWorkflowDefinitionParser(), new YamlWorkflowDefinitionParser()));
    }

    public WorkflowLoader(WorkflowRegistry registry, List<WorkflowDefinitionParser> parsers) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.parsers = List.copyOf(parsers);
    }

    /**
     * Loads {@code *.json}, {@code *.yaml} and {@code *.yml} files directly inside the
     * directory, in file name order. A missing directory yields an empty report.
     */
    public LoadReport loadDirectory(Path directory) {
        LoadReport report = new LoadReport();
        if (!Files.isDirectory(directory)) {
            logger.warning("Workflow directory does not exist: " + directory.toAbsolutePath());
            return report;
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(file -> parserFor(file).isPresent())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to list workflow directory " + directory, e);
            return report;
        }

        for (Path file : files) {
            loadFile(file, report);
        }
        logger.info("Loaded " + report.getLoaded().size() + " workflow(s) from " + directory +
                (report.getRejected().isEmpty() ? "" : ", rejected " + report.getRejected().size()));
        return report;
    }

    /**
     * Parses and registers a single file.
     *
     * @throws WorkflowParseException if the file cannot be parsed or has no matching parser
     * @throws WorkflowRegistrationException if the definition is invalid
     */
    public WorkflowDefinition loadFile(Path file) throws WorkflowParseException, WorkflowRegistrationException {
        WorkflowDefinitionParser parser = parserFor(file)
                .orElseThrow(() -> new WorkflowParseException("No parser for workflow file: " + file));
        WorkflowDefinition definition = parser.parse(file);
        registry.register(definition);
        return definition;
    }

    private void loadFile(Path file, LoadReport report) {
        try {
            WorkflowDefinition definition = loadFile(file);
            report.loaded.put(file, definition.getId());
        } catch (WorkflowParseException e) {
            logger.severe("Skipping workflow file " + file.getFileName() + ": " + e.getMessage());
            report.rejected.put(file, e.getMessage());
        } catch (WorkflowRegistrationException e) {
            logger.warning("Skipping workflow file " + file.getFileName() + ": " + e.getMessage());
            report.rejected.put(file, e.getMessage());
        }
    }

    private Optional<WorkflowDefinitionParser> parserFor(Path file) {
        return parsers.stream().filter(parser -> parser.supports(file)).findFirst();
    }

    /**
     * What a directory load registered and what it skipped.
     */
    public static class LoadReport {

        private final Map<Path, String> loaded = new LinkedHashMap<>();
        private final Map<Path, String> rejected = new LinkedHashMap<>();

        /**
         * File to registered workflow id.
         */
        public Map<Path, String> getLoaded() {
            return Collections.unmodifiableMap(loaded);
        }

        /**
         * File to rejection reason.
         */
        public Map<Path, String> getRejected() {
            return Collections.unmodifiableMap(rejected);
        }

        public List<String> getLoadedWorkflowIds() {
            return new ArrayList<>(loaded.values());
        }

        @Override
        public String toString() {
            return "LoadReport{loaded=" + loaded.values() + ", rejected=" + rejected.size() + "}";
        }
    }
}
