package org.cpoanalyzer.cli.rendering;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.cpoanalyzer.polefigure.PoleFigure;
import org.cpoanalyzer.polefigure.PoleFigureGrid;
import org.cpoanalyzer.projection.LambertGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a pole figure grid into a PNG image.
 * <p>
 * Layout:
 * <ul>
 *   <li>optional header with the particle summary and elasticity percentages</li>
 *   <li>one square panel per (axis, mineral): axes left to right, minerals top to bottom</li>
 *   <li>one legend per mineral row on the right, showing the shared maximum</li>
 * </ul>
 * Densities are raised to {@code gamma}, divided by the color scale top raised to
 * {@code gamma} and looked up in the gradient. Cells outside the projected disk stay white.
 * <p>
 * <strong>Thread Safety:</strong> Stateless; every call draws into its own image.
 */
public class PoleFigureImageRenderer implements IPoleFigureRenderer {

    private static final Logger log = LoggerFactory.getLogger(PoleFigureImageRenderer.class);

    static final int FIGURE_SIZE = 800;
    static final int SMALL_FIGURE_SIZE = 500;
    static final int LEGEND_WIDTH = 200;
    static final int SMALL_LEGEND_WIDTH = 150;
    static final int HEADER_HEIGHT = 150;
    static final int RIGHT_PADDING = 10;

    // visible plane range around the projected disk, extra room on the right/top for the X/Z labels
    private static final double PLANE_MIN = -LambertGrid.PLANE_RADIUS - 0.05;
    private static final double PLANE_MAX = LambertGrid.PLANE_RADIUS + 0.15;

    private static final int LEGEND_STEPS = 150;
    private static final String FONT_FAMILY = "SansSerif";

    @Override
    public void render(PoleFigurePlot plot, Path outputFile) throws IOException {
        if (plot.figures().isEmpty()) {
            log.info("No figures to make for particle {}, skipping {}", plot.particle().id(), outputFile);
            return;
        }
        BufferedImage image = draw(plot);
        if (!ImageIO.write(image, "png", outputFile.toFile())) {
            throw new IOException("No PNG writer available for " + outputFile);
        }
        log.debug("Wrote {}x{} pole figure image {}", image.getWidth(), image.getHeight(), outputFile);
    }

    /**
     * Draws the plot into a new image.
     *
     * @param plot a plot with at least one axis and one mineral.
     * @return the image.
     */
    public BufferedImage draw(PoleFigurePlot plot) {
        RenderOptions options = plot.options();
        PoleFigureGrid figures = plot.figures();
        int figureSize = figureSize(options);
        int headerHeight = options.elasticityHeader() ? HEADER_HEIGHT : 0;

        BufferedImage image = new BufferedImage(
                imageWidth(options, figures.axisCount()),
                imageHeight(options, figures.mineralCount()),
                BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());

            if (options.elasticityHeader()) {
                drawHeader(g, plot, image.getWidth());
            }

            Font labelFont = new Font(FONT_FAMILY, Font.PLAIN, options.smallFigure() ? 35 : 45);
            for (int a = 0; a < figures.axisCount(); a++) {
                for (int m = 0; m < figures.mineralCount(); m++) {
                    int x0 = a * figureSize;
                    int y0 = headerHeight + m * figureSize;
                    drawPanel(g, figures.get(a, m), plot.grid(), options, x0, y0, figureSize, labelFont);
                }
            }

            int legendX = figures.axisCount() * figureSize + RIGHT_PADDING;
            for (int m = 0; m < figures.mineralCount(); m++) {
                drawLegend(g, figures.get(0, m).maxCount(), options, legendX, headerHeight + m * figureSize,
                        legendWidth(options), figureSize, labelFont);
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    static int figureSize(RenderOptions options) {
        return options.smallFigure() ? SMALL_FIGURE_SIZE : FIGURE_SIZE;
    }

    static int legendWidth(RenderOptions options) {
        return options.smallFigure() ? SMALL_LEGEND_WIDTH : LEGEND_WIDTH;
    }

    static int imageWidth(RenderOptions options, int axisCount) {
        return axisCount * figureSize(options) + RIGHT_PADDING + legendWidth(options);
    }

    static int imageHeight(RenderOptions options, int mineralCount) {
        return mineralCount * figureSize(options) + (options.elasticityHeader() ? HEADER_HEIGHT : 0);
    }

    // ─────────────────────────────────────────────────────────────────────────────
    // Panels
    // ─────────────────────────────────────────────────────────────────────────────

    private void drawPanel(Graphics2D g, PoleFigure figure, LambertGrid grid, RenderOptions options,
                           int x0, int y0, int size, Font labelFont) {
        double scaleTop = options.maxCountMethod().scaleTop(figure.maxCount());
        double scaleTopGamma = Math.pow(scaleTop, options.gamma());
        double[][] counts = figure.counts();
        int n = grid.size();

        for (int row = 0; row < n - 1; row++) {
            for (int col = 0; col < n - 1; col++) {
                if (!grid.isValid(row, col)) {
                    continue;
                }
                double t = scaleTopGamma > 0 ? Math.pow(counts[row][col], options.gamma()) / scaleTopGamma : 0.0;
                g.setColor(new Color(options.gradient().rgbAt(t)));

                Path2D.Double cell = new Path2D.Double();
                cell.moveTo(toPixelX(grid.planeX(row + 1, col), x0, size), toPixelY(grid.planeZ(row + 1, col), y0, size));
                cell.lineTo(toPixelX(grid.planeX(row + 1, col + 1), x0, size), toPixelY(grid.planeZ(row + 1, col + 1), y0, size));
                cell.lineTo(toPixelX(grid.planeX(row, col + 1), x0, size), toPixelY(grid.planeZ(row, col + 1), y0, size));
                cell.lineTo(toPixelX(grid.planeX(row, col), x0, size), toPixelY(grid.planeZ(row, col), y0, size));
                cell.closePath();
                g.fill(cell);
            }
        }

        // Schmidt net boundary
        double r = LambertGrid.PLANE_RADIUS;
        double left = toPixelX(-r, x0, size);
        double top = toPixelY(r, y0, size);
        g.setColor(Color.BLACK);
        g.setStroke(new BasicStroke(5f));
        g.draw(new Ellipse2D.Double(left, top, toPixelX(r, x0, size) - left, toPixelY(-r, y0, size) - top));

        g.setFont(labelFont);
        g.drawString("Z", (int) (x0 + size * 0.464), (int) (y0 + size * 0.11 - 85 * size / (double) FIGURE_SIZE + labelFont.getSize()));
        g.drawString("X", (int) (x0 + size * 0.96 - labelFont.getSize() / 2.0), (int) (y0 + size / 2.0));

        if (!options.noDescriptionText()) {
            Font bold = labelFont.deriveFont(Font.BOLD);
            g.setFont(bold);
            int textX = (int) (x0 + size * 0.005);
            g.drawString(figure.mineral().label(), textX, y0 + bold.getSize());
            g.drawString(figure.axis().label(), textX, y0 + 2 * bold.getSize() + 8);
        }
    }

    private static double toPixelX(double planeX, int x0, int size) {
        return x0 + (planeX - PLANE_MIN) / (PLANE_MAX - PLANE_MIN) * size;
    }

    private static double toPixelY(double planeZ, int y0, int size) {
        return y0 + (PLANE_MAX - planeZ) / (PLANE_MAX - PLANE_MIN) * size;
    }

    // ─────────────────────────────────────────────────────────────────────────────
    // Legend and header
    // ─────────────────────────────────────────────────────────────────────────────

    private void drawLegend(Graphics2D g, double maxCount, RenderOptions options,
                            int x0, int y0, int width, int height, Font labelFont) {
        Font font = labelFont.deriveFont(labelFont.getSize2D() * 0.6f);
        g.setFont(font);
        g.setColor(Color.BLACK);
        g.drawString(String.format(Locale.ROOT, "%.2f%s", maxCount, options.maxCountMethod().legendSuffix()),
                x0, y0 + font.getSize() + 10);

        int barTop = y0 + font.getSize() + 25;
        int barBottom = y0 + height - 25;
        int barWidth = width / 3;
        double stepHeight = (barBottom - barTop) / (double) LEGEND_STEPS;
        for (int i = 0; i < LEGEND_STEPS; i++) {
            double fraction = i / (double) (LEGEND_STEPS - 1);
            // gamma applied so the legend matches the panels
            g.setColor(new Color(options.gradient().rgbAt(Math.pow(fraction, options.gamma()))));
            int yTop = (int) Math.floor(barBottom - (i + 1) * stepHeight);
            int yBottom = (int) Math.ceil(barBottom - i * stepHeight);
            g.fillRect(x0, yTop, barWidth, Math.max(1, yBottom - yTop));
        }
        g.setColor(Color.BLACK);
        g.setStroke(new BasicStroke(1f));
        g.drawRect(x0, barTop, barWidth, barBottom - barTop);
        g.drawString("0", x0 + barWidth + 5, barBottom);
    }

    private void drawHeader(Graphics2D g, PoleFigurePlot plot, int imageWidth) {
        Font font = new Font(FONT_FAMILY, Font.PLAIN, plot.options().smallFigure() ? 24 : 38);
        g.setFont(font);
        g.setColor(Color.BLACK);
        int lineHeight = font.getSize() + 8;
        int margin = 10;

        g.drawString(ElasticityHeader.summaryLine(plot.particle(), plot.time(), plot.figures().grains()),
                margin, lineHeight);

        List<String[]> columns = ElasticityHeader.symmetryColumns(plot.particle());
        for (int c = 0; c < columns.size(); c++) {
            int x = margin + (int) (imageWidth * 0.2 * c);
            g.drawString(columns.get(c)[0], x, 2 * lineHeight);
            g.drawString(columns.get(c)[1], x, 3 * lineHeight);
        }
    }
}
