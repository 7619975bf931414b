package com.causalchain.tools;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "causality-cli", mixinStandardHelpOptions = true, version = "Causality CLI 1.0",
        description = "Command line inspector for a running causality tracker",
        subcommands = {CausalityCli.Chains.class, CausalityCli.Timeline.class,
                CausalityCli.Export.class, CausalityCli.Stats.class})
public class CausalityCli implements Callable<Integer> {

    private static final HttpClient HTTP_CLIENT = HttpClient.newHttpClient();
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-a", "--api-url"}, description = "Base URL of the causality API.",
            defaultValue = "http://localhost:8080/api/v1")
    private String apiBaseUrl;

    @Override
    public Integer call() {
        spec.commandLine().getErr().println("No command specified. Use 'chains', 'timeline', 'export' or 'stats'. See --help for details.");
        return 1;
    }

    /**
     * GET against the API; prints the error and returns null on a non-200 answer.
     */
    private String get(String path, PrintWriter err) throws Exception {
        HttpRequest request = HttpRequest.newBuilder().uri(new URI(apiBaseUrl + path)).GET().build();
        HttpResponse<String> response = HTTP_CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            err.println("API Error: " + response.statusCode());
            err.println(response.body());
            return null;
        }
        return response.body();
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) return "";
        return str.length() > maxLength ? str.substring(0, maxLength) : str;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    @CommandLine.Command(name = "chains", mixinStandardHelpOptions = true, description = "List live chains.")
    static class Chains implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CausalityCli parent;

        @CommandLine.Option(names = {"-t", "--type"}, description = "Root cause type, e.g. user_action.")
        private String type;

        @CommandLine.Option(names = {"--tag"}, description = "Keep chains carrying any of these tags.")
        private List<String> tags;

        @CommandLine.Option(names = {"--errors-only"}, description = "Keep only chains with a failed event.")
        private boolean errorsOnly;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = parent.spec.commandLine().getOut();
            PrintWriter err = parent.spec.commandLine().getErr();

            StringJoiner query = new StringJoiner("&", "?", "").setEmptyValue("");
            if (type != null) {
                query.add("type=" + URLEncoder.encode(type, StandardCharsets.UTF_8));
            }
            if (tags != null) {
                for (String tag : tags) {
                    query.add("tags=" + URLEncoder.encode(tag, StandardCharsets.UTF_8));
                }
            }
            if (errorsOnly) {
                query.add("hasError=true");
            }

            String body = parent.get("/chains" + query, err);
            if (body == null) {
                return 1;
            }

            JsonNode chains = OBJECT_MAPPER.readTree(body);
            out.printf("%-44s %-16s %-28s %-7s %-6s %-6s%n", "Chain", "Root type", "Root cause", "Events", "Depth", "Ended");
            out.println("-".repeat(112));
            for (JsonNode chain : chains) {
                JsonNode root = chain.get("rootCause");
                JsonNode metadata = chain.get("metadata");
                out.printf("%-44s %-16s %-28s %-7d %-6d %-6s%n",
                        truncate(text(chain, "id"), 44),
                        truncate(text(root, "type"), 16),
                        truncate(text(root, "description"), 28),
                        metadata.path("eventCount").asInt(),
                        metadata.path("maxDepth").asInt(),
                        metadata.hasNonNull("endTime") ? "yes" : "no");
            }
            out.println(chains.size() + " chain(s)");
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "timeline", mixinStandardHelpOptions = true,
            description = "Show the events of a chain as a causal tree or in start-time order.")
    static class Timeline implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CausalityCli parent;

        @CommandLine.Parameters(index = "0", description = "The chain id.")
        private String chainId;

        @CommandLine.Option(names = {"-f", "--format"}, description = "Output format: tree, table, json", defaultValue = "tree")
        private String format;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = parent.spec.commandLine().getOut();
            PrintWriter err = parent.spec.commandLine().getErr();

            String body = parent.get("/chains/" + chainId + "/timeline", err);
            if (body == null) {
                return 1;
            }
            JsonNode timeline = OBJECT_MAPPER.readTree(body);

            switch (format.toLowerCase(Locale.ROOT)) {
                case "json":
                    out.println(OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(timeline));
                    break;
                case "table":
                    printTableFormat(timeline, out);
                    break;
                case "tree":
                default:
                    printTreeFormat(timeline, out);
                    break;
            }
            out.flush();
            return 0;
        }

        private void printTableFormat(JsonNode timeline, PrintWriter out) {
            out.printf("%-15s %-6s %-16s %-30s %-10s %-8s%n", "Start", "Depth", "Type", "Description", "Duration", "Error");
            out.println("-".repeat(90));
            for (JsonNode entry : timeline) {
                JsonNode event = entry.get("event");
                JsonNode error = event.path("metadata").get("error");
                out.printf("%-15s %-6d %-16s %-30s %-10s %-8s%n",
                        event.path("timing").path("startTime").asText(),
                        entry.path("depth").asInt(),
                        truncate(text(event, "type"), 16),
                        truncate(text(event, "description"), 30),
                        entry.hasNonNull("duration") ? entry.get("duration").asText() + "ms" : "running",
                        error != null && !error.isNull() ? truncate(text(error, "message"), 8) : "");
            }
        }

        private void printTreeFormat(JsonNode timeline, PrintWriter out) {
            Map<String, List<String>> parentToChildren = new HashMap<>();
            Map<String, String> labels = new HashMap<>();
            List<String> roots = new ArrayList<>();

            for (JsonNode entry : timeline) {
                JsonNode event = entry.get("event");
                String id = text(event, "id");
                List<String> children = new ArrayList<>();
                entry.path("children").forEach(child -> children.add(child.asText()));
                parentToChildren.put(id, children);

                String duration = entry.hasNonNull("duration") ? entry.get("duration").asText() + "ms" : "running";
                String failed = event.path("metadata").hasNonNull("error") ? " !! " + text(event.path("metadata").get("error"), "message") : "";
                labels.put(id, "[" + text(event, "type") + "] " + text(event, "description") + " " + duration + failed);

                if (!event.hasNonNull("parentId")) {
                    roots.add(id);
                }
            }

            out.println("\n=== Causality Chain " + truncate(chainId, 20) + "... ===");
            if (roots.isEmpty()) {
                out.println("No root event found.");
                return;
            }
            for (String rootId : roots) {
                printAsciiTree(rootId, "", true, parentToChildren, labels, out);
            }
        }

        private void printAsciiTree(String nodeId, String prefix, boolean isTail,
                                    Map<String, List<String>> tree, Map<String, String> labels, PrintWriter out) {
            out.println(prefix + (isTail ? "└── " : "├── ") + labels.getOrDefault(nodeId, nodeId));

            List<String> children = tree.getOrDefault(nodeId, Collections.emptyList());
            for (int i = 0; i < children.size(); i++) {
                printAsciiTree(children.get(i), prefix + (isTail ? "    " : "│   "),
                        i == children.size() - 1, tree, labels, out);
            }
        }
    }

    @CommandLine.Command(name = "export", mixinStandardHelpOptions = true,
            description = "Print the full export (chain, timeline, performance) of a chain as JSON.")
    static class Export implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CausalityCli parent;

        @CommandLine.Parameters(index = "0", description = "The chain id.")
        private String chainId;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = parent.spec.commandLine().getOut();
            String body = parent.get("/chains/" + chainId + "/export", parent.spec.commandLine().getErr());
            if (body == null) {
                return 1;
            }
            Object json = OBJECT_MAPPER.readValue(body, Object.class);
            out.println(OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json));
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "stats", mixinStandardHelpOptions = true, description = "Print tracker statistics.")
    static class Stats implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CausalityCli parent;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = parent.spec.commandLine().getOut();
            String body = parent.get("/tracker/stats", parent.spec.commandLine().getErr());
            if (body == null) {
                return 1;
            }
            out.println(body);
            out.flush();
            return 0;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CausalityCli()).execute(args);
        System.exit(exitCode);
    }
}
