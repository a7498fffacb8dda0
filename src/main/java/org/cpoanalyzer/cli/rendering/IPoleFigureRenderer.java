package org.cpoanalyzer.cli.rendering;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Consumer of completed pole figure grids.
 * <p>
 * Only fully assembled plots are passed in; a failed particle never reaches the renderer.
 * <p>
 * <strong>Thread Safety:</strong> Implementations are shared by all experiment workers and
 * must be thread-safe.
 */
public interface IPoleFigureRenderer {

    /**
     * Renders and writes one plot.
     *
     * @param plot       the plot.
     * @param outputFile target file; its directory exists.
     * @throws IOException if the output cannot be written.
     */
    void render(PoleFigurePlot plot, Path outputFile) throws IOException;
}
