package org.cpoanalyzer.data.compression;

import java.io.IOException;
import java.io.InputStream;

/**
 * Decoding seam for shard files that may be written compressed.
 * <p>
 * <strong>Thread Safety:</strong> Implementations are stateless; each call wraps its own stream.
 */
public interface ICompressionCodec {

    /**
     * @return short codec name used in logs, e.g. {@code "zlib"}.
     */
    String getName();

    /**
     * Wraps a raw file stream so that reads return decompressed bytes. Closing the returned
     * stream closes {@code in}.
     *
     * @param in raw stream.
     * @return decoding stream.
     * @throws IOException if the stream header cannot be read.
     */
    InputStream wrapInputStream(InputStream in) throws IOException;
}
