package org.cpoanalyzer.data.compression;

/**
 * Selects the shard codec from the experiment-wide {@code compressed} flag.
 */
public final class CompressionCodecFactory {

    private CompressionCodecFactory() {
    }

    public static ICompressionCodec forFlag(boolean compressed) {
        return compressed ? new ZlibCodec() : new NoneCodec();
    }
}
