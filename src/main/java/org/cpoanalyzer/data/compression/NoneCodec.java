package org.cpoanalyzer.data.compression;

import java.io.InputStream;

/**
 * Pass-through codec for uncompressed shard files.
 */
public final class NoneCodec implements ICompressionCodec {

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }
}
