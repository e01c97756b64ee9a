package com.score.reconciliation.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.score.reconciliation.aggregate.AggregationResult;
import com.score.reconciliation.aggregate.ExclusionCounts;
import com.score.reconciliation.api.PipelineResult;
import com.score.reconciliation.join.DataPoint;
import com.score.reconciliation.join.JoinDiagnostics;
import com.score.reconciliation.join.JoinResult;
import com.score.reconciliation.join.MissingExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Renders pipeline results as JSON for reporting and export tools.
 *
 * <p>Layout:</p>
 * <pre>
 * {
 *   "label": "...",
 *   "groups": {"canonical": ["member", ...]},        // only groups with more than one member
 *   "aggregation": {"sources": {...}, "combined": {...}, "invalidCanonical": [...], "exclusions": {...}},
 *   "combinedJoin": {"dataPoints": [...], "baseline": {...}, "diagnostics": {...}},
 *   "perSourceJoins": {"source": {...}}
 * }
 * </pre>
 */
public class PipelineReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(PipelineReportRenderer.class);

    private static final int TOP_MISSING_LIMIT = 10;

    private final ObjectMapper objectMapper;
    private final boolean pretty;

    public PipelineReportRenderer() {
        this(false);
    }

    public PipelineReportRenderer(boolean pretty) {
        this.objectMapper = new ObjectMapper();
        this.pretty = pretty;
        if (pretty) {
            objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public String render(PipelineResult result) {
        try {
            return objectMapper.writeValueAsString(toTree(result));
        } catch (JsonProcessingException e) {
            log.warn("report.renderFailed label={} error={}", result.label(), e.getMessage());
            return "{}";
        }
    }

    public ObjectNode toTree(PipelineResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("label", result.label());

        ObjectNode groups = root.putObject("groups");
        result.mapping().groups().forEach((canonical, members) -> {
            if (members.size() > 1) {
                ArrayNode array = groups.putArray(canonical);
                members.forEach(array::add);
            }
        });

        root.set("aggregation", aggregationNode(result.aggregation()));
        root.set("combinedJoin", joinNode(result.combinedJoin()));

        ObjectNode perSource = root.putObject("perSourceJoins");
        result.perSourceJoins().forEach((source, join) -> perSource.set(source, joinNode(join)));
        return root;
    }

    public boolean isPretty() {
        return pretty;
    }

    private ObjectNode aggregationNode(AggregationResult aggregation) {
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode sources = node.putObject("sources");
        aggregation.perSource().forEach((source, scores) -> sources.set(source, scoreMap(scores)));
        node.set("combined", scoreMap(aggregation.combined()));
        ArrayNode invalid = node.putArray("invalidCanonical");
        aggregation.invalidCanonical().forEach(invalid::add);

        ExclusionCounts counts = aggregation.exclusions();
        ObjectNode exclusions = node.putObject("exclusions");
        exclusions.put("accepted", counts.accepted());
        exclusions.put("invalid", counts.invalid());
        exclusions.put("mergeVotes", counts.mergeVotes());
        exclusions.put("blankId", counts.blankId());
        exclusions.put("missingScore", counts.missingScore());
        exclusions.put("malformedScore", counts.malformedScore());
        exclusions.put("invalidGroup", counts.invalidGroup());
        return node;
    }

    private ObjectNode joinNode(JoinResult join) {
        ObjectNode node = objectMapper.createObjectNode();
        ArrayNode points = node.putArray("dataPoints");
        for (DataPoint point : join.dataPoints()) {
            ObjectNode p = points.addObject();
            p.put("dimension", point.dimensionValue());
            p.put("score", point.score());
            p.put("canonicalId", point.canonicalId());
        }
        node.set("baseline", scoreMap(join.baseline()));

        JoinDiagnostics diagnostics = join.diagnostics();
        ObjectNode diag = node.putObject("diagnostics");
        diag.put("totalRows", diagnostics.totalRows());
        diag.put("numericRows", diagnostics.numericRows());
        diag.put("numericCandidates", diagnostics.numericCandidates());
        diag.put("numericWithScore", diagnostics.numericWithScore());
        diag.put("missingTotal", diagnostics.missingTotal());
        ArrayNode examples = diag.putArray("missingExamples");
        for (MissingExample example : diagnostics.missingExamples()) {
            examples.addObject()
                    .put("raw", example.rawIdentifier())
                    .put("canonical", example.canonicalIdentifier());
        }
        ObjectNode top = diag.putObject("topMissing");
        List<Map.Entry<String, Long>> topMissing = diagnostics.topMissing(TOP_MISSING_LIMIT);
        topMissing.forEach(e -> top.put(e.getKey(), e.getValue()));
        return node;
    }

    private ObjectNode scoreMap(Map<String, Double> scores) {
        ObjectNode node = objectMapper.createObjectNode();
        scores.forEach((id, score) -> node.put(id, score.doubleValue()));
        return node;
    }
}
