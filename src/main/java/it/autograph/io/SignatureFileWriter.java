package it.autograph.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SignatureFileWriter {

    private static final Logger logger = LoggerFactory.getLogger(SignatureFileWriter.class);

    public void write(ByteBuffer bytes, Path target) throws IOException {
        ByteBuffer source = bytes.duplicate();
        int size = source.remaining();
        try (FileChannel channel = FileChannel.open(target,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            while (source.hasRemaining()) {
                channel.write(source);
            }
        }
        logger.debug("Wrote {} bytes to {}", size, target);
    }
}
