package com.causalchain.controller;

import com.causalchain.core.*;
import com.causalchain.dto.*;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.*;

/**
 * HTTP view of the tracker for debugging tools. Recording endpoints mirror
 * the tracker's lifecycle operations; read endpoints return snapshots.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CausalityController {

    private static final Logger LOG = LoggerFactory.getLogger(CausalityController.class);

    private final CausalityTracker tracker;

    @PostMapping("/chains")
    public ResponseEntity<?> startChain(@RequestBody StartChainRequest request) {
        try {
            CausalEventType type = CausalEventType.fromWireName(request.type);
            String description = requireDescription(request.description);
            EventDetails details = toDetails(request.severity, request.tags, request.data);

            String chainId = tracker.startChain(type, description, request.context, details);

            URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                    .path("/{id}")
                    .buildAndExpand(chainId)
                    .toUri();
            return ResponseEntity.created(location).body(tracker.getChain(chainId).orElse(null));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("Invalid argument: " + e.getMessage());
        } catch (Exception e) {
            LOG.error("Failed to start chain", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Internal server error: " + e.getMessage());
        }
    }

    @PostMapping("/chains/{chainId}/events")
    public ResponseEntity<?> addEvent(@PathVariable String chainId, @RequestBody AddEventRequest request) {
        try {
            CausalEventType type = CausalEventType.fromWireName(request.type);
            String description = requireDescription(request.description);
            EventDetails details = toDetails(request.severity, request.tags, request.data);

            String eventId = tracker.addEvent(type, description, request.context, details, chainId, request.parentEventId);

            URI location = ServletUriComponentsBuilder.fromCurrentContextPath()
                    .path("/api/v1/events/{id}")
                    .buildAndExpand(eventId)
                    .toUri();
            return ResponseEntity.created(location).body(tracker.getEvent(eventId).orElse(null));
        } catch (CausalityTracker.ChainNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("Invalid argument: " + e.getMessage());
        } catch (Exception e) {
            LOG.error("Failed to add event to chain {}", chainId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Internal server error: " + e.getMessage());
        }
    }

    @PostMapping("/events/{eventId}/complete")
    public ResponseEntity<?> completeEvent(@PathVariable String eventId,
                                           @RequestBody(required = false) CompleteEventRequest request) {
        Optional<CausalEvent> existing = tracker.getEvent(eventId);
        if (existing.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Event not found: " + eventId);
        }
        if (request != null && request.errorMessage != null) {
            tracker.completeEventWithError(eventId, RecordedError.of(request.errorType, request.errorMessage));
        } else {
            tracker.completeEvent(eventId);
        }
        return ResponseEntity.ok(tracker.getEvent(eventId).orElse(null));
    }

    @PostMapping("/chains/{chainId}/end")
    public ResponseEntity<?> endChain(@PathVariable String chainId) {
        if (tracker.getChain(chainId).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Chain not found: " + chainId);
        }
        tracker.endChain(chainId);
        return ResponseEntity.ok(tracker.getChain(chainId).orElse(null));
    }

    @GetMapping("/chains")
    public ResponseEntity<?> getChains(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(required = false) Boolean hasError) {
        try {
            ChainFilter filter = ChainFilter.builder()
                    .type(type != null ? CausalEventType.fromWireName(type) : null)
                    .startFrom(from)
                    .startTo(to)
                    .tags(tags)
                    .hasError(hasError)
                    .build();
            return ResponseEntity.ok(tracker.getChains(filter));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("Invalid argument: " + e.getMessage());
        }
    }

    @GetMapping("/chains/{chainId}")
    public ResponseEntity<?> getChain(@PathVariable String chainId) {
        Optional<CausalityChain> chain = tracker.getChain(chainId);
        if (chain.isPresent()) {
            return ResponseEntity.ok(chain.get());
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Chain not found: " + chainId);
    }

    @GetMapping("/chains/{chainId}/timeline")
    public ResponseEntity<?> getTimeline(@PathVariable String chainId) {
        Optional<CausalityChain> chain = tracker.getChain(chainId);
        if (chain.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Chain not found: " + chainId);
        }
        return ResponseEntity.ok(ChainAnalyzer.timeline(chain.get()));
    }

    @GetMapping("/chains/{chainId}/performance")
    public ResponseEntity<?> getPerformance(@PathVariable String chainId) {
        Optional<CausalityChain> chain = tracker.getChain(chainId);
        if (chain.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Chain not found: " + chainId);
        }
        return ResponseEntity.ok(ChainAnalyzer.performance(chain.get()));
    }

    @GetMapping("/chains/{chainId}/export")
    public ResponseEntity<?> exportChain(@PathVariable String chainId) {
        Optional<ChainExport> export = tracker.exportChain(chainId);
        if (export.isPresent()) {
            return ResponseEntity.ok(export.get());
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Chain not found: " + chainId);
    }

    @GetMapping("/chains/{chainId}/graph/json")
    public ResponseEntity<?> getChainGraphJson(@PathVariable String chainId) {
        Optional<CausalityChain> chain = tracker.getChain(chainId);
        if (chain.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Error: Chain not found: " + chainId);
        }
        return ResponseEntity.ok(GraphData.of(chain.get()));
    }

    @GetMapping("/chains/{chainId}/graph/dot")
    public ResponseEntity<String> getChainGraphDot(@PathVariable String chainId) {
        Optional<CausalityChain> found = tracker.getChain(chainId);
        if (found.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Error: Chain not found: " + chainId);
        }
        CausalityChain chain = found.get();

        StringBuilder dotBuilder = new StringBuilder();
        dotBuilder.append("digraph CausalityChain {\n");
        dotBuilder.append("    rankdir=\"LR\"; // Left-to-Right layout: Cause -> Effect\n");
        dotBuilder.append("    node [shape=box, style=\"filled,rounded\", fillcolor=lightcyan];\n");
        dotBuilder.append("    edge [arrowhead=vee];\n\n");

        for (CausalEvent event : chain.getEvents()) {
            String fill = event.getMetadata().hasError() ? ", fillcolor=salmon" : "";
            String label = String.format("%s\\n(%s)\\nID:%.14s",
                    escapeDot(event.getDescription()),
                    event.getType().wireName(),
                    event.getId());
            dotBuilder.append(String.format("    \"%s\" [label=\"%s\"%s];\n", event.getId(), label, fill));
        }
        dotBuilder.append("\n");

        for (CausalEvent event : chain.getEvents()) {
            for (String childId : event.getChildIds()) {
                dotBuilder.append(String.format("    \"%s\" -> \"%s\";\n", event.getId(), childId));
            }
        }
        dotBuilder.append("}\n");

        return ResponseEntity.ok()
                .header("Content-Type", "text/vnd.graphviz")
                .body(dotBuilder.toString());
    }

    @GetMapping("/events/{eventId}")
    public ResponseEntity<?> getEvent(@PathVariable String eventId) {
        Optional<CausalEvent> event = tracker.getEvent(eventId);
        if (event.isPresent()) {
            return ResponseEntity.ok(event.get());
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Event not found: " + eventId);
    }

    @GetMapping("/events/{eventId}/ancestry")
    public ResponseEntity<?> getAncestry(@PathVariable String eventId) {
        List<String> ancestry = tracker.getCausalAncestry(eventId);
        if (ancestry.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Event not found: " + eventId);
        }
        return ResponseEntity.ok(ancestry);
    }

    @GetMapping("/events/{eventId}/descendants")
    public ResponseEntity<?> getDescendants(@PathVariable String eventId) {
        List<String> descendants = tracker.getCausalDescendants(eventId);
        if (descendants.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Event not found: " + eventId);
        }
        return ResponseEntity.ok(descendants);
    }

    @GetMapping("/context")
    public ResponseEntity<Map<String, Object>> getContext() {
        return ResponseEntity.ok(tracker.getCausalityContext());
    }

    @GetMapping("/tracker/stats")
    public ResponseEntity<String> getTrackerStats() {
        return ResponseEntity.ok(tracker.getStats());
    }

    private static String requireDescription(String description) {
        if (description == null || description.trim().isEmpty()) {
            throw new IllegalArgumentException("Field 'description' is required and cannot be empty.");
        }
        return description;
    }

    private static EventDetails toDetails(String severity, List<String> tags, Object data) {
        return EventDetails.builder()
                .severity(severity != null ? Severity.fromWireName(severity) : null)
                .tags(tags != null ? tags : Collections.emptyList())
                .data(data)
                .build();
    }

    private static String escapeDot(String value) {
        return value == null ? "" : value.replace("\"", "\\\"");
    }
}
