package com.pdqhash.image;

import com.pdqhash.hasher.HashBuffers;
import com.pdqhash.hasher.HashResult;
import com.pdqhash.hasher.PdqHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Decodes image files with {@link ImageIO} and hashes them with a
 * {@link PdqHasher}. Holds its own {@link HashBuffers}, so an instance must
 * stay on one thread; the wrapped hasher may be shared.
 */
public class ImageHasher {

    private static final Logger logger = LoggerFactory.getLogger(ImageHasher.class);

    private final PdqHasher hasher;
    private final HashBuffers buffers = new HashBuffers();

    public ImageHasher(PdqHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
    }

    public static BufferedImage read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Unsupported or unreadable image format: " + file);
        }
        return image;
    }

    public static BufferedImage read(InputStream in) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new IOException("Unsupported or unreadable image format");
        }
        return image;
    }

    public HashResult hash(BufferedImage image) {
        return hasher.hash(new BufferedImagePixelGrid(image), buffers);
    }

    public HashResult hash(InputStream in) throws IOException {
        return hash(read(in));
    }

    public ImageHashReport hashFile(Path file) throws IOException {
        long start = System.nanoTime();
        BufferedImage image = read(file);
        long decoded = System.nanoTime();
        HashResult result = hash(image);
        long done = System.nanoTime();

        long readMillis = (decoded - start) / 1_000_000;
        long hashMillis = (done - decoded) / 1_000_000;
        logger.debug("Hashed {} ({}x{}) read={}ms hash={}ms", file, image.getWidth(), image.getHeight(),
                readMillis, hashMillis);
        return new ImageHashReport(file.toString(), result, image.getWidth(), image.getHeight(), readMillis,
                hashMillis);
    }
}
