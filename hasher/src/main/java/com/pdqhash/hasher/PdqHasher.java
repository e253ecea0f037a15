package com.pdqhash.hasher;

import com.pdqhash.config.HasherConfig;
import com.pdqhash.hash.Hash256;
import com.pdqhash.hasher.filter.JaroszFilter;
import com.pdqhash.hasher.math.DctBasis;
import com.pdqhash.hasher.math.DctTransform;
import com.pdqhash.hasher.math.DctTransformFactory;
import com.pdqhash.hasher.math.MedianSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes 256-bit PDQ hashes from decoded pixel grids.
 *
 * Pipeline: RGB -> luma -> Jarosz smoothing -> 64x64 decimation ->
 * quality metric -> 16x16 DCT -> median -> one bit per coefficient above
 * the median.
 *
 * The DCT basis is built once per hasher and only read afterwards, so one
 * instance can be shared by any number of threads as long as each thread
 * brings its own {@link HashBuffers} (the single-argument {@link #hash}
 * allocates fresh ones per call).
 */
public class PdqHasher {

    private static final Logger logger = LoggerFactory.getLogger(PdqHasher.class);

    private final DctBasis basis;
    private final DctTransform dct;
    private final JaroszFilter jarosz;

    public PdqHasher() {
        this(HasherConfig.defaults());
    }

    public PdqHasher(HasherConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        this.basis = new DctBasis();
        this.dct = DctTransformFactory.create(config.dctTransform, basis);
        this.jarosz = new JaroszFilter(config.jaroszPasses, config.windowSizeDivisor);
        logger.info("PdqHasher initialized: dct={}, jaroszPasses={}, windowSizeDivisor={}",
                dct.getName(), jarosz.getPasses(), jarosz.getWindowSizeDivisor());
    }

    public DctBasis getBasis() {
        return basis;
    }

    public DctTransform getDctTransform() {
        return dct;
    }

    public JaroszFilter getJaroszFilter() {
        return jarosz;
    }

    public HashResult hash(PixelGrid grid) {
        return hash(grid, new HashBuffers());
    }

    public HashResult hash(PixelGrid grid, HashBuffers buffers) {
        // 1. Validate
        if (grid == null) {
            throw new InvalidImageException("pixel grid is null");
        }
        Objects.requireNonNull(buffers, "buffers must not be null");
        int numCols = grid.getWidth();
        int numRows = grid.getHeight();
        if (numCols <= 0 || numRows <= 0) {
            throw new InvalidImageException("dimensions must be positive, got " + numCols + "x" + numRows);
        }

        // 2. Luma
        buffers.ensureCapacity(pixelCount(numRows, numCols));
        LumaConverter.fillLuma(grid, buffers.buffer1());

        return hashFromLuma(buffers, numRows, numCols);
    }

    /**
     * Hashes a row-major luma image. The values are copied into the scratch
     * buffers, so {@code luma} itself is left untouched.
     */
    public HashResult hashLuma(float[] luma, int numRows, int numCols, HashBuffers buffers) {
        Objects.requireNonNull(buffers, "buffers must not be null");
        if (luma == null) {
            throw new InvalidImageException("luma buffer is null");
        }
        if (numRows <= 0 || numCols <= 0) {
            throw new InvalidImageException("dimensions must be positive, got " + numCols + "x" + numRows);
        }
        int numPixels = pixelCount(numRows, numCols);
        if (luma.length < numPixels) {
            throw new InvalidImageException("luma buffer holds " + luma.length + " values, need " + numPixels);
        }
        buffers.ensureCapacity(numPixels);
        System.arraycopy(luma, 0, buffers.buffer1(), 0, numPixels);
        return hashFromLuma(buffers, numRows, numCols);
    }

    private HashResult hashFromLuma(HashBuffers buffers, int numRows, int numCols) {
        // 3. Smooth
        jarosz.smooth(buffers.buffer1(), buffers.buffer2(), numRows, numCols);

        // 4. Decimate
        float[] buffer64x64 = buffers.buffer64x64();
        Decimator.decimate(buffers.buffer1(), numRows, numCols, buffer64x64);

        // 5. Quality
        int quality = QualityMetric.compute(buffer64x64);

        // 6. DCT
        float[] buffer16x16 = buffers.buffer16x16();
        dct.dct64To16(buffer64x64, buffers.buffer16x64(), buffer16x16);

        // 7-8. Median and thresholding
        Hash256 hash = bitsFromDct(buffer16x16);

        if (logger.isDebugEnabled()) {
            logger.debug("Hashed {}x{} image: windows={}x{}, quality={}, hash={}", numCols, numRows,
                    jarosz.windowSizeFor(numCols), jarosz.windowSizeFor(numRows), quality, hash);
        }
        return new HashResult(hash, quality);
    }

    private static int pixelCount(int numRows, int numCols) {
        try {
            return Math.multiplyExact(numRows, numCols);
        } catch (ArithmeticException e) {
            throw new InvalidImageException(numCols + "x" + numRows + " image is too large to hash", e);
        }
    }

    /**
     * Sets bit {@code i * 16 + j} for every coefficient strictly above the
     * median of the 16x16 grid. Ties stay clear.
     */
    static Hash256 bitsFromDct(float[] dctOutput16x16) {
        Hash256 hash = new Hash256();
        float dctMedian = MedianSelector.torbenMedian(dctOutput16x16, 0, 256);
        for (int i = 0; i < 16; i++) {
            for (int j = 0; j < 16; j++) {
                if (dctOutput16x16[i * 16 + j] > dctMedian) {
                    hash.setBit(i * 16 + j);
                }
            }
        }
        return hash;
    }
}
