package com.example.corprisk.model.ownership;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of tracing control-holders from a target company, with the aggregate
 * metrics the ownership rules read.
 */
@Getter
public class OwnershipTrace {

    private final String companyNumber;
    private final List<OwnershipNode> layers;
    /** Company numbers whose control-holders were fetched, in visiting order. */
    private final List<String> visitedCompanies;

    private final int corporateLayers;
    private final List<OwnershipNode> foreignEntities;
    private final int trustCount;
    private final int maxDepth;

    public OwnershipTrace(String companyNumber, List<OwnershipNode> layers, List<String> visitedCompanies) {
        this.companyNumber = companyNumber;
        this.layers = List.copyOf(layers);
        this.visitedCompanies = List.copyOf(visitedCompanies);

        Tally tally = new Tally();
        tally.walk(this.layers, 0);
        this.corporateLayers = tally.corporateLayers;
        this.foreignEntities = List.copyOf(tally.foreign);
        this.trustCount = tally.trusts;
        this.maxDepth = tally.maxDepth;
    }

    public int getForeignCount() {
        return foreignEntities.size();
    }

    private static final class Tally {
        int corporateLayers;
        int trusts;
        int maxDepth;
        final List<OwnershipNode> foreign = new ArrayList<>();

        void walk(List<OwnershipNode> nodes, int depth) {
            for (OwnershipNode node : nodes) {
                maxDepth = Math.max(maxDepth, depth);
                if (node.isTrust()) trusts++;
                if (node.isForeign()) foreign.add(node);
                if (!node.isTerminal() || !node.getSubLayers().isEmpty()) {
                    corporateLayers++;
                    walk(node.getSubLayers(), depth + 1);
                }
            }
        }
    }
}
