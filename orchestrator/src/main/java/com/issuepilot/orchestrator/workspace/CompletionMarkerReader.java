package com.issuepilot.orchestrator.workspace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.CompletionMarker;
import com.issuepilot.orchestrator.model.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads and validates the completion marker a backend writes.
 *
 * Well-formed means: a JSON object with string {@code task_id} and
 * {@code summary}; {@code files_changed} and {@code commands_run}, when
 * present, are arrays of strings. Anything else counts as "not done yet" so a
 * half-written file is never mistaken for completion.
 */
@Component
public class CompletionMarkerReader {

    private static final Logger log = LoggerFactory.getLogger(CompletionMarkerReader.class);

    private static final List<String> REFUSAL_MARKERS = List.of(
            "i'm sorry",
            "i am sorry",
            "i cannot help",
            "i can't help",
            "cannot assist",
            "can't assist",
            "i won't be able to",
            "i refuse");

    private final ObjectMapper json;
    private final String       markerFile;

    @Autowired
    public CompletionMarkerReader(ObjectMapper objectMapper, IssuePilotProperties props) {
        this(objectMapper, props.getWorkspace().getMarkerFile());
    }

    public CompletionMarkerReader(ObjectMapper objectMapper, String markerFile) {
        this.json       = objectMapper;
        this.markerFile = markerFile;
    }

    public Path markerPath(Workspace workspace) {
        return workspace.resolve(markerFile);
    }

    public boolean exists(Workspace workspace) {
        return Files.isRegularFile(markerPath(workspace));
    }

    /** @return the marker if present and well-formed */
    public Optional<CompletionMarker> read(Workspace workspace) {
        Path path = markerPath(workspace);
        if (!Files.isRegularFile(path)) return Optional.empty();
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            log.warn("Could not read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<CompletionMarker> parse(String content) {
        JsonNode root;
        try {
            root = json.readTree(content);
        } catch (IOException e) {
            log.warn("Completion marker is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()
                || !root.path("task_id").isTextual()
                || !root.path("summary").isTextual()) {
            log.warn("Completion marker is missing task_id or summary");
            return Optional.empty();
        }

        Optional<List<String>> files     = stringArray(root, "files_changed");
        Optional<List<String>> commands  = stringArray(root, "commands_run");
        Optional<List<String>> questions = stringArray(root, "blocked_questions");
        if (files.isEmpty() || commands.isEmpty() || questions.isEmpty()) {
            log.warn("Completion marker has a malformed list field");
            return Optional.empty();
        }

        String status = root.path("status").isTextual() ? root.path("status").asText() : null;
        if (root.path("blocked").asBoolean(false)) {
            status = "blocked";
        }
        return Optional.of(new CompletionMarker(
                root.get("task_id").asText(),
                root.get("summary").asText(),
                files.get(),
                commands.get(),
                status,
                questions.get()));
    }

    /** The backend declined the task instead of doing it. */
    public boolean isRefusal(CompletionMarker marker) {
        String summary = marker.summary().toLowerCase(Locale.ROOT).replace('’', '\'');
        return REFUSAL_MARKERS.stream().anyMatch(summary::contains);
    }

    /** Missing field: empty list. Present but not an array of strings: empty Optional. */
    private static Optional<List<String>> stringArray(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) return Optional.of(List.of());
        if (!node.isArray()) return Optional.empty();
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) return Optional.empty();
            values.add(item.asText());
        }
        return Optional.of(values);
    }
}
