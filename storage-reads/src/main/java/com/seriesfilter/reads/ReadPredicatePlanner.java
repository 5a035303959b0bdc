package com.seriesfilter.reads;

import com.seriesfilter.expression.Expression;
import com.seriesfilter.expression.Literal;
import com.seriesfilter.optimizer.PredicateOptimizer;
import com.seriesfilter.predicate.MeasurementScopeAnalyzer;
import com.seriesfilter.reads.config.ReadFilterConfig;
import com.seriesfilter.reads.converter.FilterNodeConverter;
import com.seriesfilter.reads.converter.TranslationException;
import com.seriesfilter.reads.proto.Node;
import com.seriesfilter.reads.proto.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Prepares the filter of a storage read request.
 *
 * <p>This is the entry point for read filters: it translates the filter tree,
 * determines whether the read is confined to a single measurement, and
 * derives the tag-only condition that can be pushed down to the series index.
 *
 * <p>Example usage:
 * <pre>
 *   ReadPredicatePlanner planner = new ReadPredicatePlanner(ReadFilterConfig.fromSystemProperties());
 *   ReadPredicate predicate = planner.plan(request.getPredicate());
 *   predicate.measurement().ifPresent(index::restrictToMeasurement);
 * </pre>
 *
 * <p>Planning holds no state between calls; one planner serves all requests.
 */
public class ReadPredicatePlanner {
    private static final Logger logger = LoggerFactory.getLogger(ReadPredicatePlanner.class);

    private final ReadFilterConfig config;
    private final FilterNodeConverter converter;
    private final PredicateOptimizer optimizer;

    public ReadPredicatePlanner() {
        this(ReadFilterConfig.defaults());
    }

    public ReadPredicatePlanner(ReadFilterConfig config) {
        this(config, new PredicateOptimizer());
    }

    /**
     * Creates a planner with a custom optimizer for the index condition.
     *
     * @param config the translation settings
     * @param optimizer the optimizer that derives the index condition
     */
    public ReadPredicatePlanner(ReadFilterConfig config, PredicateOptimizer optimizer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.converter = new FilterNodeConverter(config.maxNodeDepth());
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
    }

    /**
     * Plans a read predicate message. A message without a root matches
     * everything.
     *
     * @param predicate the predicate message, may be null
     * @return the planned predicate
     * @throws TranslationException if the filter tree is malformed
     */
    public ReadPredicate plan(Predicate predicate) {
        if (predicate == null || !predicate.hasRoot()) {
            logger.debug("Read has no filter, matching all series");
            return ReadPredicate.matchAll();
        }
        return plan(predicate.getRoot());
    }

    /**
     * Plans a filter tree.
     *
     * @param root the root of the filter tree
     * @return the planned predicate
     * @throws TranslationException if the filter tree is malformed
     */
    public ReadPredicate plan(Node root) {
        Objects.requireNonNull(root, "root must not be null");

        Expression condition = converter.convert(root, config.tagKeyRemap());
        Optional<String> measurement = MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(condition);
        Expression indexCondition = optimizer.optimize(condition);

        if (indexCondition instanceof Literal lit && lit.isTrue()) {
            indexCondition = null;
        }

        logger.debug("Planned read filter {}: measurement={}, indexCondition={}",
            condition, measurement.orElse(null), indexCondition);
        return new ReadPredicate(condition, measurement.orElse(null), indexCondition);
    }
}
