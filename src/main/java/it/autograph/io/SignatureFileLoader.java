package it.autograph.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a file read-only so the locator can scan it without loading it onto the heap.
 */
@Component
public class SignatureFileLoader {

    public static final int MINIMUM_FILE_SIZE = 4;

    private static final Logger logger = LoggerFactory.getLogger(SignatureFileLoader.class);

    public ByteBuffer load(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size < MINIMUM_FILE_SIZE) {
                throw new FileTooSmallException("file too small to contain ASN.1 structure");
            }
            if (size > Integer.MAX_VALUE) {
                throw new IOException("file too large to map: " + size + " bytes");
            }
            // the mapping stays valid after the channel is closed
            MappedByteBuffer mapped = channel.map(FileChannel.MapMode.READ_ONLY, 0, size);
            logger.debug("Mapped {} ({} bytes)", path, size);
            return mapped;
        }
    }
}
