package com.causalchain.dto;

import com.causalchain.core.CausalEvent;
import lombok.Data;

/**
 * Cause-to-effect link. {@code depth} and {@code failed} describe the effect,
 * so a viewer can dash edges into failed events and rank them by depth.
 */
@Data
public class GraphEdge {

    public String from;
    public String to;
    public String arrows = "to";
    public int depth;
    public boolean failed;
    public boolean dashes;

    public GraphEdge(CausalEvent cause, CausalEvent effect) {
        this.from = cause.getId();
        this.to = effect.getId();
        this.depth = effect.getMetadata().getDepth();
        this.failed = effect.getMetadata().hasError();
        this.dashes = failed;
    }
}
