package com.task.tablescan.reconstruct;

import com.task.tablescan.model.Grid;
import com.task.tablescan.model.Row;
import com.task.tablescan.model.RowCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Snaps row cells onto column anchors. Realignment only happens when there are
 * more than one and fewer anchors than cells in the first row; otherwise the
 * rows pass through unchanged.
 */
public class GridAligner {

    private static final Logger log = LoggerFactory.getLogger(GridAligner.class);

    public Grid align(List<Row> rows, List<Double> anchors) {
        if (!shouldAlign(rows, anchors)) {
            return Grid.fromRows(rows);
        }
        log.debug("Realigning {} rows onto {} column anchors", rows.size(), anchors.size());

        List<List<String>> aligned = new ArrayList<>(rows.size());
        for (Row row : rows) {
            StringBuilder[] slots = new StringBuilder[anchors.size()];
            for (RowCell cell : row.cells()) {
                int column = nearestAnchor(cell.x(), anchors);
                if (slots[column] == null) {
                    slots[column] = new StringBuilder(cell.text());
                } else {
                    slots[column].append(' ').append(cell.text());
                }
            }
            List<String> cells = new ArrayList<>(slots.length);
            for (StringBuilder slot : slots) {
                cells.add(slot == null ? "" : slot.toString());
            }
            aligned.add(cells);
        }
        return new Grid(aligned);
    }

    static boolean shouldAlign(List<Row> rows, List<Double> anchors) {
        return !rows.isEmpty() && anchors.size() > 1 && anchors.size() < rows.get(0).size();
    }

    // ties go to the leftmost anchor
    static int nearestAnchor(int x, List<Double> anchors) {
        int best = 0;
        double bestDistance = Math.abs(x - anchors.get(0));
        for (int i = 1; i < anchors.size(); i++) {
            double distance = Math.abs(x - anchors.get(i));
            if (distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        return best;
    }
}
