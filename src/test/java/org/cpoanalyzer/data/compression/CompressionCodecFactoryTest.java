package org.cpoanalyzer.data.compression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.ZipException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CompressionCodecFactoryTest {

    @Test
    void forFlag_selectsCodec() {
        assertThat(CompressionCodecFactory.forFlag(true)).isInstanceOf(ZlibCodec.class);
        assertThat(CompressionCodecFactory.forFlag(false)).isInstanceOf(NoneCodec.class);
        assertThat(CompressionCodecFactory.forFlag(true).getName()).isEqualTo("zlib");
        assertThat(CompressionCodecFactory.forFlag(false).getName()).isEqualTo("none");
    }

    @Test
    void zlibCodec_inflatesZlibStream() throws Exception {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (DeflaterOutputStream out = new DeflaterOutputStream(compressed)) {
            out.write("id mineral_0_EA_phi\n1 2.0\n".getBytes(StandardCharsets.UTF_8));
        }

        try (InputStream in = new ZlibCodec().wrapInputStream(new ByteArrayInputStream(compressed.toByteArray()))) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("id mineral_0_EA_phi\n1 2.0\n");
        }
    }

    @Test
    void zlibCodec_corruptStreamFailsOnRead() throws Exception {
        InputStream in = new ZlibCodec().wrapInputStream(
                new ByteArrayInputStream("id x\n1 2\n".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(in::readAllBytes).isInstanceOf(ZipException.class);
    }
}
