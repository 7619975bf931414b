package com.causalchain.dto;

import com.causalchain.core.CausalEvent;
import com.causalchain.core.CausalityChain;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes and cause-to-effect edges of one chain, in the shape vis.js expects.
 */
@Data
@AllArgsConstructor
public class GraphData {

    public List<GraphNode> nodes;
    public List<GraphEdge> edges;

    public static GraphData of(CausalityChain chain) {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        Map<String, CausalEvent> byId = new HashMap<>();
        for (CausalEvent event : chain.getEvents()) {
            byId.put(event.getId(), event);
        }
        for (CausalEvent event : chain.getEvents()) {
            String title = String.format("Type: %s\nDepth: %d\nID: %s",
                    event.getType().wireName(), event.getMetadata().getDepth(), event.getId());
            nodes.add(new GraphNode(event.getId(), event.getDescription(), title,
                    event.getType().wireName(), event.getMetadata().getDepth()));
            for (String childId : event.getChildIds()) {
                CausalEvent child = byId.get(childId);
                if (child != null) {
                    edges.add(new GraphEdge(event, child));
                }
            }
        }
        return new GraphData(nodes, edges);
    }
}
