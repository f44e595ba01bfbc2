package it.autograph.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SignatureFileLoaderTest {

    private final SignatureFileLoader loader = new SignatureFileLoader();

    @TempDir
    Path tempDir;

    @Test
    void shouldMapWholeFileReadOnly() throws IOException {
        byte[] content = new byte[] {0x30, (byte) 0x82, 0x00, 0x01, 0x05};
        Path file = Files.write(tempDir.resolve("signed.bin"), content);

        ByteBuffer mapped = loader.load(file);

        assertEquals(ByteBuffer.wrap(content), mapped);
        assertTrue(mapped.isReadOnly());
    }

    @Test
    void shouldRejectFileSmallerThanMinimum() throws IOException {
        Path file = Files.write(tempDir.resolve("tiny.bin"), new byte[] {0x30, (byte) 0x82, 0x00});

        FileTooSmallException ex = assertThrows(FileTooSmallException.class, () -> loader.load(file));

        assertEquals("file too small to contain ASN.1 structure", ex.getMessage());
    }

    @Test
    void shouldFailForMissingFile() {
        Path missing = tempDir.resolve("missing.bin");

        IOException ex = assertThrows(IOException.class, () -> loader.load(missing));

        assertTrue(ex instanceof NoSuchFileException);
        assertFalse(ex instanceof FileTooSmallException);
    }
}
