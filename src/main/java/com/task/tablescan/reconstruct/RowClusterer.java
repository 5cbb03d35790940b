package com.task.tablescan.reconstruct;

import com.task.tablescan.model.Row;
import com.task.tablescan.model.RowCell;
import com.task.tablescan.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups tokens into rows using a vertical threshold derived from the median
 * gap between sorted {@code y} values.
 *
 * <p>Tokens must arrive in top-to-bottom reading order. Each token is compared
 * with the token right before it, not with the first token of its row, so one
 * large jump starts a new row even inside a visually continuous line.</p>
 */
public class RowClusterer {

    private static final Logger log = LoggerFactory.getLogger(RowClusterer.class);

    private final double gapMultiplier;
    private final double minThreshold;
    private final double maxThreshold;
    private final double defaultGap;

    public RowClusterer() {
        this(1.3, 15, 50, 30);
    }

    public RowClusterer(double gapMultiplier, double minThreshold, double maxThreshold, double defaultGap) {
        if (minThreshold > maxThreshold) {
            throw new IllegalArgumentException("minThreshold " + minThreshold + " exceeds maxThreshold " + maxThreshold);
        }
        this.gapMultiplier = gapMultiplier;
        this.minThreshold = minThreshold;
        this.maxThreshold = maxThreshold;
        this.defaultGap = defaultGap;
    }

    public List<Row> cluster(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return List.of();
        }

        double threshold = threshold(tokens);
        log.debug("Row threshold {} for {} tokens", threshold, tokens.size());

        List<Row> rows = new ArrayList<>();
        List<RowCell> current = new ArrayList<>();
        Integer previousY = null;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (previousY != null && Math.abs((long) token.y() - previousY) >= threshold) {
                rows.add(toRow(current));
                current = new ArrayList<>();
            }
            current.add(new RowCell(i, token.text(), token.x(), token.confidence()));
            previousY = token.y();
        }
        rows.add(toRow(current));

        return rows;
    }

    double threshold(List<Token> tokens) {
        List<Integer> ys = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            ys.add(token.y());
        }
        ys.sort(null);

        double medianGap = Medians.ofSorted(Medians.consecutiveGaps(ys)).orElse(defaultGap);
        return Math.max(minThreshold, Math.min(maxThreshold, medianGap * gapMultiplier));
    }

    private static Row toRow(List<RowCell> cells) {
        // List.sort is stable: equal x keeps reading order
        cells.sort(Comparator.comparingInt(RowCell::x));
        return new Row(cells);
    }
}
