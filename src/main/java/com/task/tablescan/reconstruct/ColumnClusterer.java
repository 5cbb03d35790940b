package com.task.tablescan.reconstruct;

import com.task.tablescan.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Derives column anchors, left to right, from the {@code x} coordinates of all tokens.
 * Sorted positions are swept once; a gap of at least the threshold closes a
 * cluster, whose median becomes an anchor.
 */
public class ColumnClusterer {

    private static final Logger log = LoggerFactory.getLogger(ColumnClusterer.class);

    private final double gapMultiplier;
    private final double minThreshold;

    public ColumnClusterer() {
        this(2.0, 20);
    }

    public ColumnClusterer(double gapMultiplier, double minThreshold) {
        this.gapMultiplier = gapMultiplier;
        this.minThreshold = minThreshold;
    }

    public List<Double> anchors(List<Token> tokens) {
        List<Integer> xs = sortedXs(tokens);
        OptionalDouble medianGap = Medians.ofSorted(Medians.consecutiveGaps(xs));
        if (medianGap.isEmpty()) {
            return List.of();
        }
        double threshold = Math.max(minThreshold, medianGap.getAsDouble() * gapMultiplier);
        List<Double> anchors = anchors(tokens, threshold);
        log.debug("Column threshold {} produced {} anchors", threshold, anchors.size());
        return anchors;
    }

    /**
     * Clusters with a fixed gap threshold instead of the adaptive one.
     */
    public List<Double> anchors(List<Token> tokens, double threshold) {
        List<Integer> xs = sortedXs(tokens);
        if (xs.size() < 2) {
            return List.of();
        }

        List<Double> anchors = new ArrayList<>();
        List<Integer> cluster = new ArrayList<>();
        cluster.add(xs.get(0));
        for (int i = 1; i < xs.size(); i++) {
            int x = xs.get(i);
            if ((long) x - cluster.get(cluster.size() - 1) < threshold) {
                cluster.add(x);
            } else {
                anchors.add(Medians.ofSorted(cluster).getAsDouble());
                cluster = new ArrayList<>();
                cluster.add(x);
            }
        }
        anchors.add(Medians.ofSorted(cluster).getAsDouble());
        return List.copyOf(anchors);
    }

    private static List<Integer> sortedXs(List<Token> tokens) {
        List<Integer> xs = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            xs.add(token.x());
        }
        xs.sort(null);
        return xs;
    }
}
