package it.autograph.io;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SignatureFileWriterTest {

    private final SignatureFileWriter writer = new SignatureFileWriter();

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteExactBytesAndTruncateExistingFile() throws IOException {
        Path target = Files.write(tempDir.resolve("signature.der"), new byte[64]);
        byte[] file = new byte[] {0x01, 0x02, 0x30, (byte) 0x82, 0x00, 0x00, 0x09};
        ByteBuffer block = ByteBuffer.wrap(file, 2, 4).slice();

        writer.write(block, target);

        assertArrayEquals(new byte[] {0x30, (byte) 0x82, 0x00, 0x00}, Files.readAllBytes(target));
        assertEquals(0, block.position());
    }
}
