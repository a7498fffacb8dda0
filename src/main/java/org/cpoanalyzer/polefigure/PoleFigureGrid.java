package org.cpoanalyzer.polefigure;

import java.util.List;

/**
 * Rectangular arrangement of pole figures indexed {@code [axis][mineral]}: crystal axes run
 * along the horizontal direction of the rendered layout, minerals along the vertical one.
 *
 * @param axes     axes in column order.
 * @param minerals minerals in row order.
 * @param figures  {@code figures[axisIndex][mineralIndex]}.
 * @param grains   number of grains that went into every figure.
 */
public record PoleFigureGrid(List<CrystalAxis> axes, List<Mineral> minerals, PoleFigure[][] figures, int grains) {

    public PoleFigureGrid {
        axes = List.copyOf(axes);
        minerals = List.copyOf(minerals);
        if (figures.length != axes.size()) {
            throw new IllegalArgumentException("Expected " + axes.size() + " axis columns, got " + figures.length);
        }
        for (PoleFigure[] column : figures) {
            if (column.length != minerals.size()) {
                throw new IllegalArgumentException("Expected " + minerals.size() + " mineral rows, got " + column.length);
            }
        }
    }

    public PoleFigure get(int axisIndex, int mineralIndex) {
        return figures[axisIndex][mineralIndex];
    }

    public int axisCount() {
        return axes.size();
    }

    public int mineralCount() {
        return minerals.size();
    }

    public boolean isEmpty() {
        return axes.isEmpty() || minerals.isEmpty();
    }
}
