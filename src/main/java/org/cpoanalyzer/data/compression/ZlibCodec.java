package org.cpoanalyzer.data.compression;

import java.io.IOException;
import java.io.InputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Codec for zlib-wrapped (RFC 1950) deflate streams, the format the simulation uses when
 * particle output compression is enabled. A corrupt stream surfaces as
 * {@link java.util.zip.ZipException} on read, a truncated one as {@link java.io.EOFException}.
 */
public final class ZlibCodec implements ICompressionCodec {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public String getName() {
        return "zlib";
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        Inflater inflater = new Inflater();
        return new InflaterInputStream(in, inflater, BUFFER_SIZE) {
            @Override
            public void close() throws IOException {
                try {
                    super.close();
                } finally {
                    inflater.end();
                }
            }
        };
    }
}
